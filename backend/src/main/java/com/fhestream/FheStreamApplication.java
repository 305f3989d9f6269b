package com.fhestream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FheStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(FheStreamApplication.class, args);
    }
}
