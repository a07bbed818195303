package com.medassist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MedAssistApplication {

    public static void main(String[] args) {
        SpringApplication.run(MedAssistApplication.class, args);
    }
}
