package com.architecture.memory.dbimpact;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DbImpactApplication {

    public static void main(String[] args) {
        SpringApplication.run(DbImpactApplication.class, args);
    }
}
