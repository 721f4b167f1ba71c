package com.adlanda.ethicsassistant.controller;

import com.adlanda.ethicsassistant.model.HealthStatus;
import com.adlanda.ethicsassistant.service.AnswerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reports the health of the answer pipeline's dependencies.
 */
@RestController
@RequestMapping("/api/v1/rag")
public class HealthController {

    private final AnswerService answerService;

    public HealthController(AnswerService answerService) {
        this.answerService = answerService;
    }

    /**
     * Always 200; the body carries the per-dependency and overall status.
     */
    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        return ResponseEntity.ok(answerService.healthCheck());
    }
}
