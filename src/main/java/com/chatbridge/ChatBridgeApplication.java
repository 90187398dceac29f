package com.chatbridge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class ChatBridgeApplication {

    public static void main(String[] args) {
        log.info("Starting chat-bridge application");
        SpringApplication.run(ChatBridgeApplication.class, args);
        log.info("chat-bridge application started");
    }

}
