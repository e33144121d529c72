package com.mindcanvus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MindCanvusApplication {

    public static void main(String[] args) {
        SpringApplication.run(MindCanvusApplication.class, args);
    }
}
