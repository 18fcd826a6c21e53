package com.ospicorp.geosimple.web;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {
  private final String serviceName;

  public RootController(@Value("${spring.application.name:geosimple}") String serviceName) {
    this.serviceName = serviceName;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", serviceName);
    body.put("status", "ok");
    body.put("companies", "/v1/companies");
    body.put("docs", "/v3/api-docs");
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
