package com.example.gdprpdp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GdprPdpApplication {

    public static void main(String[] args) {
        SpringApplication.run(GdprPdpApplication.class, args);
    }
}
