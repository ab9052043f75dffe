package com.gomesguardian.thesis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThesisServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThesisServiceApplication.class, args);
    }
}
