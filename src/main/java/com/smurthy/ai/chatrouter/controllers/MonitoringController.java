package com.smurthy.ai.chatrouter.controllers;

import com.smurthy.ai.chatrouter.observability.RoutingMetrics;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Monitoring endpoint
 */
@RestController
@RequestMapping("/monitoring")
class MonitoringController {

    private final RoutingMetrics routingMetrics;

    public MonitoringController(RoutingMetrics routingMetrics) {
        this.routingMetrics = routingMetrics;
    }

    @GetMapping("/routing")
    public RoutingMetrics.MetricsSummary getRoutingMetrics() {
        return routingMetrics.getMetricsSummary();
    }

    @PostMapping("/routing/reset")
    public void resetRoutingMetrics() {
        routingMetrics.logMetricsSummary();
        routingMetrics.resetMetrics();
    }
}
