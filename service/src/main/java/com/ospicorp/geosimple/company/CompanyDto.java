package com.ospicorp.geosimple.company;

public record CompanyDto(
    Integer id,
    String name,
    Double latitude,
    Double longitude,
    PointDto geom
) {

  public static CompanyDto from(Company company) {
    return new CompanyDto(
        company.getId(),
        company.getName(),
        company.getLatitude(),
        company.getLongitude(),
        PointDto.from(company.getGeom()));
  }
}
