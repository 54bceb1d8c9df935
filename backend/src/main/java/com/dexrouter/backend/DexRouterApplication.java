package com.dexrouter.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DexRouterApplication {
    public static void main(String[] args) {
        SpringApplication.run(DexRouterApplication.class, args);
    }
}
