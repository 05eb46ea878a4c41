package com.bastion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for Bastion.
 *
 * Bastion detects coordinated attack campaigns in streams of authentication
 * attempts, attributes them to campaign types and threat actors, and feeds the
 * indicators it derives back into the reputation data used to score new attempts.
 */
@SpringBootApplication
@EnableScheduling
public class BastionApplication {

    public static void main(String[] args) {
        SpringApplication.run(BastionApplication.class, args);
    }
}
