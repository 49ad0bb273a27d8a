package com.fhi.my_pets.controller;

import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness check.
 */
@RestController
public class HelloController
{
    static final String GREETING = "Hello from MyPets API!";

    @GetMapping("/api/hello")
    public Map<String, String> hello()
    {   return Map.of("message", GREETING);
    }
}
