package com.ospicorp.geosimple.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class SchemaVerificationRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(SchemaVerificationRunner.class);

  private final CompanySchemaVerifier verifier;
  private final boolean verifyOnStartup;

  public SchemaVerificationRunner(CompanySchemaVerifier verifier,
      @Value("${geosimple.schema.verify-on-startup:true}") boolean verifyOnStartup) {
    this.verifier = verifier;
    this.verifyOnStartup = verifyOnStartup;
  }

  @Override
  public void run(String... args) {
    if (!verifyOnStartup) {
      log.info("Schema verification disabled via property geosimple.schema.verify-on-startup=false");
      return;
    }
    verifier.verify();
  }
}
