package com.movi.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class MoviOrchestratorApplication {
    public static void main(String[] args) {
        SpringApplication.run(MoviOrchestratorApplication.class, args);
    }
}
