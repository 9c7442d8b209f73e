package com.govdata.discovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DataDiscoveryApplication {
    public static void main(String[] args) {
        SpringApplication.run(DataDiscoveryApplication.class, args);
    }
}
