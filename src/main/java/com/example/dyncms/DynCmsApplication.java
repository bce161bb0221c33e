package com.example.dyncms;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DynCmsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DynCmsApplication.class, args);
    }
}
