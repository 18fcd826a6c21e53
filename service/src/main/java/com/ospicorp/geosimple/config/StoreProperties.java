package com.ospicorp.geosimple.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Connection parameters of the company store. {@code application.yml} fills them from the
 * {@code tut_user}, {@code tut_password}, {@code tut_port} and {@code tut_dbname} environment
 * variables; a missing value fails startup before any connection is opened.
 */
@Validated
@ConfigurationProperties(prefix = "geosimple.store")
public record StoreProperties(
    @DefaultValue("localhost") @NotBlank String host,
    @NotNull @Min(1) @Max(65535) Integer port,
    @NotBlank String user,
    @NotBlank String password,
    @NotBlank String dbname
) {

  public String jdbcUrl() {
    return "jdbc:postgresql://" + host + ':' + port + '/' + dbname;
  }

  @Override
  public String toString() {
    return "StoreProperties[host=" + host + ", port=" + port + ", user=" + user
        + ", dbname=" + dbname + "]";
  }
}
