package com.guardrails.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the cost guardrail controller.
 */
@SpringBootApplication
public class GuardrailApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardrailApplication.class, args);
    }
}
