package com.rms.fanout.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.rms.fanout")
public class FanoutApplication {
    public static void main(String[] args) {
        SpringApplication.run(FanoutApplication.class, args);
    }
}
