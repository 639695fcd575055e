package com.incoresoft.blePresence;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableRetry
public class BlePresenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlePresenceApplication.class, args);
    }

}
