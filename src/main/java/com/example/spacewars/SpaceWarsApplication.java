package com.example.spacewars;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class SpaceWarsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpaceWarsApplication.class, args);
    }

}
