package com.oddsdata.gamesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication(scanBasePackages = "com.oddsdata.gamesync")
@EnableTransactionManagement
public class GameSyncServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameSyncServiceApplication.class, args);
    }
}
