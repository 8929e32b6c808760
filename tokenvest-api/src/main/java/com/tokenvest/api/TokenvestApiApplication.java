package com.tokenvest.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Tokenvest Platform API Application
 *
 * Vesting schedules and pool-capped token distribution for a game token.
 */
@SpringBootApplication(scanBasePackages = "com.tokenvest")
public class TokenvestApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TokenvestApiApplication.class, args);
    }
}
