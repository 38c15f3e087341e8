package com.ednataxa.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdnaTaxaApplication {
    public static void main(String[] args) {
        SpringApplication.run(EdnaTaxaApplication.class, args);
    }
}
