package com.ollamahub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OllamaHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(OllamaHubApplication.class, args);
    }
}
