package com.example.viticache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VitiCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(VitiCacheApplication.class, args);
    }
}
