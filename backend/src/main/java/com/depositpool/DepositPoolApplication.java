package com.depositpool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DepositPoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(DepositPoolApplication.class, args);
    }
}
