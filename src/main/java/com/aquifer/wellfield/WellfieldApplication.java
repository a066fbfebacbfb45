package com.aquifer.wellfield;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WellfieldApplication {

    public static void main(String[] args) {
        SpringApplication.run(WellfieldApplication.class, args);
    }
}
