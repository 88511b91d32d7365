package com.example.collab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CollaborativeChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollaborativeChatApplication.class, args);
    }
}

