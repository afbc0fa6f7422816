package com.invoice.templates;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TemplateEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TemplateEngineApplication.class, args);
    }
}
