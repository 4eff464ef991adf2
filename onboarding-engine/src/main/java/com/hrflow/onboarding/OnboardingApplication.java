package com.hrflow.onboarding;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Onboarding workflow service.
 *
 * To run against a local PostgreSQL:
 *   DB_URL=jdbc:postgresql://localhost:5432/onboarding mvn spring-boot:run
 */
@SpringBootApplication
public class OnboardingApplication {

    public static void main(String[] args) {
        SpringApplication.run(OnboardingApplication.class, args);
    }
}
