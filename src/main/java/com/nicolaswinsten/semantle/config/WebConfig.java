package com.nicolaswinsten.semantle.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** CORS for the browser frontend, origins from {@code semantle.web.allowed-origins}. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final SemantleProperties properties;

    public WebConfig(SemantleProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
            .allowedOrigins(properties.getWeb().getAllowedOrigins().toArray(String[]::new))
            .allowedMethods("GET", "POST", "OPTIONS")
            .allowedHeaders("*")
            .allowCredentials(true);
    }
}
