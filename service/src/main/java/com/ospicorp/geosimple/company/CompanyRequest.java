package com.ospicorp.geosimple.company;

import io.swagger.v3.oas.annotations.media.Schema;

// geom is not accepted from callers; unknown properties are ignored and the value is derived
public record CompanyRequest(
    @Schema(description = "Optional identifier, generated when omitted", example = "10001")
    Integer id,
    @Schema(description = "Company name", example = "geosimple", requiredMode = Schema.RequiredMode.REQUIRED)
    String name,
    @Schema(description = "WGS84 latitude", example = "45.543")
    Double latitude,
    @Schema(description = "WGS84 longitude", example = "-74.456")
    Double longitude
) {

  public Company toCompany() {
    return new Company(id, name, latitude, longitude);
  }
}
