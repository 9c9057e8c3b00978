package com.sporewriter.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * CORS configuration for browser-based graph editors.
 *
 * Allows every method and header; origins come from
 * {@code sporewriter.cors.allowed-origins}.
 */
@Configuration
public class CorsConfig implements WebFluxConfigurer {

    @Value("${sporewriter.cors.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
            .allowedOriginPatterns(allowedOrigins)
            .allowedMethods("*")
            .allowedHeaders("*");
    }
}
