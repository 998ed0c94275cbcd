package com.hvacops.copilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CopilotApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CopilotApiApplication.class, args);
    }
}
