package com.tenantseed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SeedApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SeedApplication.class, args)));
    }
}
