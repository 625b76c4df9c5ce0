package com.fooddash.orderservice.controller;

import com.fooddash.orderservice.job.MaintenanceJobRunner;
import com.fooddash.orderservice.job.SweepReport;
import com.fooddash.orderservice.security.ActorResolver;
import com.fooddash.orderservice.security.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Operator commands for running a sweep on demand, outside its cron schedule.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/internal/jobs")
@RequiredArgsConstructor
public class MaintenanceInternalController {

    private final MaintenanceJobRunner runner;
    private final ActorResolver actorResolver;

    @GetMapping
    public ResponseEntity<List<String>> listJobs(@AuthenticationPrincipal Jwt jwt) {
        actorResolver.requireRole(jwt, Role.ADMIN);
        return ResponseEntity.ok(runner.jobNames());
    }

    @PostMapping("/{jobName}")
    public ResponseEntity<SweepReport> runJob(
            @PathVariable String jobName,
            @AuthenticationPrincipal Jwt jwt) {
        UUID adminId = actorResolver.requireRole(jwt, Role.ADMIN);
        log.info("Manual maintenance run: job={}, requestedBy={}", jobName, adminId);
        return ResponseEntity.ok(runner.run(jobName));
    }
}
