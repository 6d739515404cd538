package com.demo.network;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NetworkOpportunityApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetworkOpportunityApplication.class, args);
    }
}
