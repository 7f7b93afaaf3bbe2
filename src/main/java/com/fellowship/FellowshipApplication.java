package com.fellowship;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FellowshipApplication {

    public static void main(String[] args) {
        SpringApplication.run(FellowshipApplication.class, args);
    }
}
