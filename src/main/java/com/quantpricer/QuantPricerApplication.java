package com.quantpricer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuantPricerApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuantPricerApplication.class, args);
    }
}
