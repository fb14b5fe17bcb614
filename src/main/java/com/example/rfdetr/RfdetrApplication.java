package com.example.rfdetr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RfdetrApplication {

    public static void main(String[] args) {
        SpringApplication.run(RfdetrApplication.class, args);
    }
}
