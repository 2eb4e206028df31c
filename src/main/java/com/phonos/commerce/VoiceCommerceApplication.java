package com.phonos.commerce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VoiceCommerceApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceCommerceApplication.class, args);
    }
}
