package com.perfhub.ticketsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TicketSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(TicketSyncApplication.class, args);
    }
}
