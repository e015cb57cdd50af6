package com.partshortage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PartShortagePlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PartShortagePlannerApplication.class, args);
    }
}
