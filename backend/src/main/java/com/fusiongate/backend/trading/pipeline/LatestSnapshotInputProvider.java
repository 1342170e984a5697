package com.fusiongate.backend.trading.pipeline;

import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hand-off point for the external metrics layer. Only the newest published input is kept and each
 * one is consumed by at most one cycle.
 */
@Service
public class LatestSnapshotInputProvider implements PipelineInputProvider {

    private final AtomicReference<PipelineTickInput> latest = new AtomicReference<>();

    public void publish(PipelineTickInput input) {
        latest.set(Objects.requireNonNull(input, "tick input"));
    }

    @Override
    public Optional<PipelineTickInput> nextInput() {
        return Optional.ofNullable(latest.getAndSet(null));
    }
}
