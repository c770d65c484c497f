package com.ctxlog.controller;

import com.ctxlog.logging.BoundLogger;
import com.ctxlog.logging.LogEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    @GetMapping("/health")
    public Map<String, String> health(BoundLogger log) {
        // 기본 threshold(info) 에서는 출력되지 않음
        log.debug(LogEvent.HEALTH_CHECKED);
        return Map.of(
            "status", "healthy",
            "service", "context-logging"
        );
    }
}
