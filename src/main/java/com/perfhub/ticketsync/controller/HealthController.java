package com.perfhub.ticketsync.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final DataSource ticketDataSource;

    @Value("${spring.datasource.tickets.url:not-set}")
    private String ticketDbUrl;

    public HealthController(@Qualifier("ticketDataSource") DataSource ticketDataSource) {
        this.ticketDataSource = ticketDataSource;
    }

    /**
     * UP when the ticket store answers a validity check within two seconds.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        boolean databaseUp = isDatabaseUp();
        response.put("status", databaseUp ? "UP" : "DEGRADED");
        response.put("message", "Ticket sync service is running");
        response.put("ticketStore", databaseUp ? "UP" : "DOWN");
        return ResponseEntity.status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> config() {
        Map<String, String> tickets = new LinkedHashMap<>();
        tickets.put("url", ticketDbUrl);
        tickets.put("password", "***");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("tickets", tickets);
        return ResponseEntity.ok(response);
    }

    private boolean isDatabaseUp() {
        try (Connection connection = ticketDataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Ticket store health check failed: {}", e.getMessage());
            return false;
        }
    }
}
