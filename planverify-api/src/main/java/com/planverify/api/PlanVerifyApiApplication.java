package com.planverify.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * PlanVerify API Application
 *
 * Crowd-verified insurance acceptance with decaying confidence scores.
 */
@SpringBootApplication(scanBasePackages = "com.planverify")
@EntityScan(basePackages = "com.planverify.core.domain")
@EnableJpaRepositories(basePackages = "com.planverify.core.repository")
@EnableScheduling
public class PlanVerifyApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanVerifyApiApplication.class, args);
    }
}
