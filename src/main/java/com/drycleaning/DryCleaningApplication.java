package com.drycleaning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class DryCleaningApplication {

    public static void main(String[] args) {
        SpringApplication.run(DryCleaningApplication.class, args);
    }
}
