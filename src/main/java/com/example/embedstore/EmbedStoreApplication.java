package com.example.embedstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EmbedStoreApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(EmbedStoreApplication.class, args)));
    }
}
