package com.chatrelay.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatRelayApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChatRelayApplication.class, args);
    }
}
