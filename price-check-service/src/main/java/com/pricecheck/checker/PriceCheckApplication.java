package com.pricecheck.checker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PriceCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriceCheckApplication.class, args);
    }
}
