package com.studioflow.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StudioflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudioflowApplication.class, args);
    }
}
