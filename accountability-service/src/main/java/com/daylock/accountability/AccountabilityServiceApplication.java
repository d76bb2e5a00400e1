package com.daylock.accountability;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccountabilityServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccountabilityServiceApplication.class, args);
    }
}
