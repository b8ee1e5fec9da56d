package com.recordplatform.schemashift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SchemaShiftApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchemaShiftApplication.class, args);
    }
}
