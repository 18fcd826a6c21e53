package com.ospicorp.geosimple.support;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Shares one PostGIS container across every Spring context started by the integration tests.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgisContainerTestBase {

  private static final DockerImageName POSTGIS_IMAGE = DockerImageName
      .parse("postgis/postgis:16-3.4")
      .asCompatibleSubstituteFor("postgres");

  @SuppressWarnings("resource")
  protected static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>(POSTGIS_IMAGE)
          .withDatabaseName("pt_tut")
          .withUsername("tut_user")
          .withPassword("tut_password");

  @DynamicPropertySource
  static void configureStore(DynamicPropertyRegistry registry) {
    // one container per JVM; start() returns at once when already running
    POSTGRES.start();
    registry.add("geosimple.store.host", POSTGRES::getHost);
    registry.add("geosimple.store.port", () -> POSTGRES.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT));
    registry.add("geosimple.store.user", POSTGRES::getUsername);
    registry.add("geosimple.store.password", POSTGRES::getPassword);
    registry.add("geosimple.store.dbname", POSTGRES::getDatabaseName);
  }
}
