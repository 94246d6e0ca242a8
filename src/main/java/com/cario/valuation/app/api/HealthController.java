package com.cario.valuation.app.api;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness probe. */
@RestController
public class HealthController {

  @Value("${spring.application.name:vehicle-valuation-service}")
  private String service;

  @Value("${app.version:1.0.0}")
  private String version;

  @GetMapping("/health")
  public Map<String, Object> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "healthy");
    body.put("service", service);
    body.put("version", version);
    return body;
  }
}
