package com.poufmaker.api.config;

import com.poufmaker.api.enums.BidStatus;
import com.poufmaker.api.enums.ProductStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${poufmaker.cors.allowed-origins:*}")
    private String[] allowedOrigins;

    // Query parameters use the same wire values as JSON ("ai-generated", not "AI_GENERATED").
    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, ProductStatus.class, ProductStatus::fromValue);
        registry.addConverter(String.class, BidStatus.class, BidStatus::fromValue);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedOrigins(allowedOrigins)
                .allowCredentials(false);
    }
}
