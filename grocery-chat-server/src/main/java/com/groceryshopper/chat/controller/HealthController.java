package com.groceryshopper.chat.controller;

import com.groceryshopper.chat.service.generation.GenerationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final GenerationService generationService;

    public HealthController(JdbcTemplate jdbcTemplate, GenerationService generationService) {
        this.jdbcTemplate = jdbcTemplate;
        this.generationService = generationService;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");

        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            response.put("database", "connected");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            response.put("database", "disconnected");
        }

        response.put("backends", generationService.checkAvailability());
        return response;
    }
}
