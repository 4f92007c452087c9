package com.notifica.emisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EmisorApplication {
    public static void main(String[] args) {
        SpringApplication.run(EmisorApplication.class, args);
    }
}
