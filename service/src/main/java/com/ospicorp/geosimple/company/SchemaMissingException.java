package com.ospicorp.geosimple.company;

import java.util.List;

/**
 * The postgis extension, the company table or its derivation trigger is not installed. Raised
 * separately from data errors so a broken bootstrap is diagnosed as such.
 */
public class SchemaMissingException extends RuntimeException {
  private final List<String> missing;

  public SchemaMissingException(List<String> missing) {
    super("Company schema incomplete, missing: " + String.join(", ", missing));
    this.missing = List.copyOf(missing);
  }

  public SchemaMissingException(String message, Throwable cause) {
    super(message, cause);
    this.missing = List.of();
  }

  public List<String> missing() {
    return missing;
  }
}
