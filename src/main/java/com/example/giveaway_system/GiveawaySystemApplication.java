package com.example.giveaway_system;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GiveawaySystemApplication {

    public static void main(String[] args) {
        SpringApplication.run(GiveawaySystemApplication.class, args);
    }
}
