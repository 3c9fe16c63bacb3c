package com.deepansh.adventure;

import com.deepansh.adventure.config.GameProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GameProperties.class)
public class TextAdventureApplication {
    public static void main(String[] args) {
        SpringApplication.run(TextAdventureApplication.class, args);
    }
}
