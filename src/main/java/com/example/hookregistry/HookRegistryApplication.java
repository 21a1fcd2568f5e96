package com.example.hookregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HookRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(HookRegistryApplication.class, args);
    }

}
