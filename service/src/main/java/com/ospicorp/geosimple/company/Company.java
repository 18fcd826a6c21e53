package com.ospicorp.geosimple.company;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.locationtech.jts.geom.Point;
import org.springframework.data.domain.Persistable;

@Entity
@Table(name = "company")
public class Company implements Persistable<Integer> {

  @Id
  private Integer id;
  private String name;
  private Double latitude;
  private Double longitude;

  // written only by CoordinateDerivation and the add_company_geom trigger
  @Column(columnDefinition = "geometry(Point,4326)")
  private Point geom;

  @Transient
  private boolean persisted;

  public Company() {
    // JPA default constructor
  }

  public Company(Integer id, String name, Double latitude, Double longitude) {
    this.id = id;
    this.name = name;
    this.latitude = latitude;
    this.longitude = longitude;
  }

  @Override
  public Integer getId() {
    return id;
  }

  public void setId(Integer id) {
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public Double getLatitude() {
    return latitude;
  }

  public void setLatitude(Double latitude) {
    this.latitude = latitude;
  }

  public Double getLongitude() {
    return longitude;
  }

  public void setLongitude(Double longitude) {
    this.longitude = longitude;
  }

  public Point getGeom() {
    return geom;
  }

  void setGeom(Point geom) {
    this.geom = geom;
  }

  /**
   * Ids are assigned before the first save, so Spring Data cannot tell new rows from stored
   * ones by a null id. A company is new until it has been loaded or persisted once.
   */
  @Override
  public boolean isNew() {
    return !persisted;
  }

  @PostLoad
  @PostPersist
  void markPersisted() {
    this.persisted = true;
  }
}
