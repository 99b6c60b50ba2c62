package com.williamcallahan.aivisibility;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AiVisibilityApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiVisibilityApplication.class, args);
    }
}
