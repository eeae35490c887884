package com.example.academics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AcademicsApplication {

    public static void main(String[] args) {
        SpringApplication.run(AcademicsApplication.class, args);
    }
}
