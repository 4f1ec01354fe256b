package com.poufmaker.api.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SecurityPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class)
            .withPropertyValues(
                    "poufmaker.security.token-ttl=24h",
                    "poufmaker.security.reset-token-ttl=1h");

    @Test
    void startup_fails_without_a_jwt_secret() {
        contextRunner.run(context -> assertThat(context).hasFailed());
    }

    @Test
    void startup_fails_with_a_short_jwt_secret() {
        contextRunner.withPropertyValues("poufmaker.security.jwt-secret=too-short")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void binds_a_valid_configuration() {
        contextRunner.withPropertyValues("poufmaker.security.jwt-secret=a-secret-that-is-at-least-thirty-two-bytes")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    SecurityProperties properties = context.getBean(SecurityProperties.class);
                    assertThat(properties.tokenTtl()).isEqualTo(Duration.ofHours(24));
                    assertThat(properties.resetTokenTtl()).isEqualTo(Duration.ofHours(1));
                });
    }

    @EnableConfigurationProperties(SecurityProperties.class)
    static class PropertiesConfig {
    }
}
