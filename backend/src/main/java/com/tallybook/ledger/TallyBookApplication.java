package com.tallybook.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TallyBookApplication {
    public static void main(String[] args) {
        SpringApplication.run(TallyBookApplication.class, args);
    }
}
