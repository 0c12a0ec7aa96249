package com.anomalyhunter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnomalyHunterApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyHunterApplication.class, args);
    }
}
