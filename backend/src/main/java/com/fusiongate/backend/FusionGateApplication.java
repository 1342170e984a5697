package com.fusiongate.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FusionGateApplication {
    public static void main(String[] args) {
        SpringApplication.run(FusionGateApplication.class, args);
    }
}
