package com.dixonrepair.vinsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VinSearchEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(VinSearchEngineApplication.class, args);
    }
}
