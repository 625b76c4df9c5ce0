package com.fooddash.orderservice.controller;

import com.fooddash.orderservice.dto.DriverAvailabilityResponse;
import com.fooddash.orderservice.security.ActorResolver;
import com.fooddash.orderservice.security.Role;
import com.fooddash.orderservice.service.DriverAvailabilityService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

// The driver id is always the token subject; drivers cannot act for each other
@RestController
@RequestMapping("/api/v1/drivers/me")
@RequiredArgsConstructor
public class DriverController {

    private final DriverAvailabilityService availabilityService;
    private final ActorResolver actorResolver;

    @PutMapping("/heartbeat")
    public ResponseEntity<DriverAvailabilityResponse> heartbeat(@AuthenticationPrincipal Jwt jwt) {
        UUID driverId = actorResolver.requireRole(jwt, Role.DRIVER);
        return ResponseEntity.ok(availabilityService.heartbeat(driverId));
    }

    @PutMapping("/offline")
    public ResponseEntity<DriverAvailabilityResponse> goOffline(@AuthenticationPrincipal Jwt jwt) {
        UUID driverId = actorResolver.requireRole(jwt, Role.DRIVER);
        return ResponseEntity.ok(availabilityService.goOffline(driverId));
    }

    @GetMapping("/availability")
    public ResponseEntity<DriverAvailabilityResponse> getAvailability(@AuthenticationPrincipal Jwt jwt) {
        UUID driverId = actorResolver.requireRole(jwt, Role.DRIVER);
        return ResponseEntity.ok(availabilityService.getAvailability(driverId));
    }
}
