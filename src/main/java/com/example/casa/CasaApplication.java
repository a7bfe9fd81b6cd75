package com.example.casa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CasaApplication {

    public static void main(String[] args) {
        SpringApplication.run(CasaApplication.class, args);
    }
}
