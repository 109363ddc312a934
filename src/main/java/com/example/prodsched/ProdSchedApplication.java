package com.example.prodsched;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProdSchedApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProdSchedApplication.class, args);
    }
}
