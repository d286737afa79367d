package com.droidassist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DroidAssistApplication {

    public static void main(String[] args) {
        SpringApplication.run(DroidAssistApplication.class, args);
    }
}
