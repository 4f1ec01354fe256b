package com.poufmaker.api.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "poufmaker.notifications")
public record NotificationProperties(
        @NotBlank String from,
        @NotBlank String appUrl
) {
}
