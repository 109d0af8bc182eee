package com.stardust.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Stardust Secure Data Platform
 *
 * Field-level encrypted record store with access auditing, retention sweeps and
 * compliance-gated erasure.
 */
@SpringBootApplication(scanBasePackages = "com.stardust")
public class StardustApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(StardustApiApplication.class, args);
    }
}
