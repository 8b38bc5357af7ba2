package com.acme.learnlite;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LearnLiteApplication {
    public static void main(String[] args) {
        SpringApplication.run(LearnLiteApplication.class, args);
    }
}
