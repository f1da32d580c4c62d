package com.billing.leakdetector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LeakDetectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeakDetectorApplication.class, args);
    }
}
