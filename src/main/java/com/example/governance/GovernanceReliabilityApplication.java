package com.example.governance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GovernanceReliabilityApplication {

    public static void main(String[] args) {
        SpringApplication.run(GovernanceReliabilityApplication.class, args);
    }
}
