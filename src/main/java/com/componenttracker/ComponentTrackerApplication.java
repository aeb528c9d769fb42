package com.componenttracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComponentTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComponentTrackerApplication.class, args);
    }
}
