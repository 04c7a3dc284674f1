package com.federated.combiner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CombinerServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CombinerServiceApplication.class, args);
    }
}
