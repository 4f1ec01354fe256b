package com.poufmaker.api;

import com.poufmaker.api.config.NotificationProperties;
import com.poufmaker.api.config.SecurityProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({SecurityProperties.class, NotificationProperties.class})
public class PoufmakerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PoufmakerApplication.class, args);
    }
}
