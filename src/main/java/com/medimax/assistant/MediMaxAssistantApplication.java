package com.medimax.assistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediMaxAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediMaxAssistantApplication.class, args);
    }
}
