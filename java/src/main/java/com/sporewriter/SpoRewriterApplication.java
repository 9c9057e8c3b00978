package com.sporewriter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SPO Rewriter Server Application
 *
 * Graph rewriting API server built with Spring Boot WebFlux.
 */
@SpringBootApplication
public class SpoRewriterApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpoRewriterApplication.class, args);
    }

}
