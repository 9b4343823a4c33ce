package com.bbthechange.tripplanner.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    @GetMapping("/")
    public String home() {
        return "Trip planner API is running";
    }

    @GetMapping("/health")
    public String health() {
        return "OK";
    }
}
