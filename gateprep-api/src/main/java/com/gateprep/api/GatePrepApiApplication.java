package com.gateprep.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.gateprep")
public class GatePrepApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatePrepApiApplication.class, args);
    }
}
