package com.example.safespace.controller;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@Tag(name = "Health", description = "Liveness and database connectivity")
@RequiredArgsConstructor
public class HealthController {

    static final Duration DB_CHECK_TIMEOUT = Duration.ofSeconds(10);

    private final JdbcTemplate jdbcTemplate;
    private final DataSource dataSource;

    @GetMapping("/")
    public Mono<ResponseEntity<Map<String, String>>> root() {
        return Mono.just(ResponseEntity.ok(Map.of("message", "SafeSpace backend is running", "version", "1.0.0")));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, String>>> health() {
        return Mono.just(ResponseEntity.ok(Map.of("status", "up")));
    }

    @GetMapping("/health/db")
    @Operation(summary = "Check database connectivity", description = "Runs SELECT 1 with a 10 second limit.")
    public Mono<ResponseEntity<Map<String, Object>>> database() {
        log.info("Database health check requested");
        return Mono.fromCallable(() -> jdbcTemplate.queryForObject("SELECT 1", Integer.class))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(DB_CHECK_TIMEOUT)
                .map(result -> {
                    if (result == null || result != 1) {
                        return unhealthy("Database query failed");
                    }
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", "healthy");
                    body.put("database", "connected");
                    body.put("timestamp", Instant.now().toString());
                    body.put("connection_pool", poolInfo());
                    return ResponseEntity.ok(body);
                })
                .onErrorResume(ex -> {
                    log.error("Database health check error: {}", ex.toString());
                    String detail = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
                    return Mono.just(unhealthy(detail));
                });
    }

    private Object poolInfo() {
        if (dataSource instanceof HikariDataSource hikari && hikari.getHikariPoolMXBean() != null) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("total", pool.getTotalConnections());
            info.put("active", pool.getActiveConnections());
            info.put("idle", pool.getIdleConnections());
            return info;
        }
        return "unknown";
    }

    private static ResponseEntity<Map<String, Object>> unhealthy(String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "unhealthy");
        body.put("error", "service_unavailable");
        body.put("message", detail);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
