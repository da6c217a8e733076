package com.marketpulse.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketPulseApplication {
    public static void main(String[] args) {
        SpringApplication.run(MarketPulseApplication.class, args);
    }
}
