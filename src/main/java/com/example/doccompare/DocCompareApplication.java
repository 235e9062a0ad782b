package com.example.doccompare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocCompareApplication {
    public static void main(String[] args) {
        SpringApplication.run(DocCompareApplication.class, args);
    }
}
