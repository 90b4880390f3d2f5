package com.bank_sync_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BankSyncEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BankSyncEngineApplication.class, args);
    }
}
