package com.rms.possync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.rms.possync")
public class OrderSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(OrderSyncApplication.class, args);
    }
}
