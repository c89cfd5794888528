package com.example.Botlyne;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BotlyneApplication {

    public static void main(String[] args) {
        SpringApplication.run(BotlyneApplication.class, args);
    }
}
