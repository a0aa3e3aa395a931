package com.example.sheetsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SheetSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetSyncApplication.class, args);
    }
}
