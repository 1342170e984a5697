package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.config.FusionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Cooldown gate between a trade decision and the execution layer. The only state is the time of the
 * last approval.
 */
@Service
@Slf4j
public class TradeTrigger {

    static final String COOLDOWN_ACTIVE = "Cooldown active";
    static final String CONDITIONS_NOT_MET = "Conditions not strong enough";

    private final FusionProperties fusionProperties;
    private Instant lastTradeTime;

    public TradeTrigger(FusionProperties fusionProperties) {
        this.fusionProperties = fusionProperties;
    }

    public enum TriggerState {
        READY,
        COOLING_DOWN
    }

    public TriggerOutput fire(TradeDecision decision) {
        return fire(decision, Instant.now());
    }

    public synchronized TriggerOutput fire(TradeDecision decision, Instant now) {
        Objects.requireNonNull(decision, "trade decision");
        double cooldown = fusionProperties.getTrigger().getCooldownMinutes();
        if (lastTradeTime != null) {
            double elapsed = elapsedMinutes(now);
            if (elapsed < cooldown) {
                return new TriggerOutput(false, TradeDecision.TradeAction.SKIP, 0.0, COOLDOWN_ACTIVE, now,
                        cooldown - elapsed);
            }
        }
        if (decision.action() != TradeDecision.TradeAction.ENTER) {
            return new TriggerOutput(false, TradeDecision.TradeAction.SKIP, 0.0, CONDITIONS_NOT_MET, now, 0.0);
        }
        lastTradeTime = now;
        log.info("Trade trigger approved score={} reason={}", decision.score(), decision.reason());
        return new TriggerOutput(true, TradeDecision.TradeAction.ENTER, decision.score(), decision.reason(), now,
                cooldown);
    }

    public synchronized TriggerState state(Instant now) {
        return remainingCooldownMinutes(now) > 0 ? TriggerState.COOLING_DOWN : TriggerState.READY;
    }

    public synchronized double remainingCooldownMinutes(Instant now) {
        if (lastTradeTime == null) {
            return 0.0;
        }
        return Math.max(0.0, fusionProperties.getTrigger().getCooldownMinutes() - elapsedMinutes(now));
    }

    public synchronized Optional<Instant> getLastTradeTime() {
        return Optional.ofNullable(lastTradeTime);
    }

    public synchronized void reset() {
        lastTradeTime = null;
    }

    synchronized void restore(Instant checkpoint) {
        lastTradeTime = checkpoint;
    }

    // Wall clock; a clock stepping backwards counts as zero elapsed time.
    private double elapsedMinutes(Instant now) {
        long millis = Duration.between(lastTradeTime, now).toMillis();
        return Math.max(0L, millis) / 60_000.0;
    }
}
