package com.tradegate.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TradegateApplication {
    public static void main(String[] args) {
        SpringApplication.run(TradegateApplication.class, args);
    }
}
