package com.example.Botlyne.controller;

import com.example.Botlyne.resilience.DependencyGuardRegistry;
import com.example.Botlyne.resilience.DependencyHealth;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class DependencyHealthController {

    private final DependencyGuardRegistry guards;

    @GetMapping("/dependencies")
    public DependencyHealth dependencies() {
        return guards.health();
    }
}
