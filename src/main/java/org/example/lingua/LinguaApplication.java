package org.example.lingua;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LinguaApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinguaApplication.class, args);
    }
}
