package com.poufmaker.api.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "poufmaker.security")
public record SecurityProperties(
        @NotBlank @Size(min = 32) String jwtSecret,
        @NotNull Duration tokenTtl,
        @NotNull Duration resetTokenTtl
) {
}
