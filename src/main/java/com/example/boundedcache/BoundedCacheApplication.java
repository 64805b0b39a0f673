package com.example.boundedcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BoundedCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(BoundedCacheApplication.class, args);
    }
}
