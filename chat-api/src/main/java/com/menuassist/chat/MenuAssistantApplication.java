package com.menuassist.chat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MenuAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(MenuAssistantApplication.class, args);
    }
}
