package com.ospicorp.geosimple.config;

import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class StoreDataSourceConfig {

  private static final Logger log = LoggerFactory.getLogger(StoreDataSourceConfig.class);

  @Bean
  DataSource dataSource(StoreProperties properties) {
    log.info("Connecting company store to {}", properties.jdbcUrl());
    return DataSourceBuilder.create()
        .type(HikariDataSource.class)
        .driverClassName("org.postgresql.Driver")
        .url(properties.jdbcUrl())
        .username(properties.user())
        .password(properties.password())
        .build();
  }
}
