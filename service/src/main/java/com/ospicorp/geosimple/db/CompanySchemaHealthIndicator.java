package com.ospicorp.geosimple.db;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class CompanySchemaHealthIndicator implements HealthIndicator {
  private final CompanySchemaVerifier verifier;

  public CompanySchemaHealthIndicator(CompanySchemaVerifier verifier) {
    this.verifier = verifier;
  }

  @Override
  public Health health() {
    SchemaReport report;
    try {
      report = verifier.inspect();
    } catch (RuntimeException ex) {
      return Health.down(ex).build();
    }
    Health.Builder builder = report.complete() ? Health.up() : Health.down();
    return builder
        .withDetail("postgis", report.postgisInstalled())
        .withDetail("trigger", report.triggerInstalled())
        .withDetail("missing", report.missing())
        .build();
  }
}
