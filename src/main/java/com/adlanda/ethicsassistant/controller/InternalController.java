package com.adlanda.ethicsassistant.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Plain-text liveness for load balancers and container orchestrators.
 */
@RestController
@RequestMapping("/internal")
public class InternalController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    @GetMapping("/liveness")
    public String liveness() {
        return "OK: " + appVersion;
    }
}
