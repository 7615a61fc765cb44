package com.flagship.drink_ledger;

import com.flagship.drink_ledger.config.LedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LedgerProperties.class)
public class DrinkLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DrinkLedgerApplication.class, args);
    }
}
