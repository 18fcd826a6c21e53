package com.ospicorp.geosimple.company;

import java.util.NoSuchElementException;

public class CompanyNotFoundException extends NoSuchElementException {
  private final int companyId;

  public CompanyNotFoundException(int companyId) {
    super("Company not found: " + companyId);
    this.companyId = companyId;
  }

  public int companyId() {
    return companyId;
  }
}
