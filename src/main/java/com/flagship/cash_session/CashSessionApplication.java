package com.flagship.cash_session;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CashSessionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CashSessionApplication.class, args);
    }
}
