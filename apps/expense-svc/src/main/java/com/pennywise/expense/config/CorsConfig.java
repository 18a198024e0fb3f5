package com.pennywise.expense.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Cross-origin policy for the browser front end. Origins and methods come from
 * {@code pennywise.cors.*}.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {
    private static final Logger log = LoggerFactory.getLogger(CorsConfig.class);

    private final PennywiseProperties properties;

    public CorsConfig(PennywiseProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        PennywiseProperties.Cors cors = properties.cors();
        log.info("CORS: origins={} methods={} credentials={}", cors.allowedOrigins(), cors.allowedMethods(), cors.allowCredentials());
        registry.addMapping("/**")
                .allowedOrigins(cors.allowedOriginsArray())
                .allowedMethods(cors.allowedMethodsArray())
                .allowedHeaders("*")
                .exposedHeaders("X-Request-Trace")
                .allowCredentials(cors.allowCredentials());
    }
}
