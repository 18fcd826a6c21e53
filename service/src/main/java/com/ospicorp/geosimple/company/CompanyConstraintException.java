package com.ospicorp.geosimple.company;

/**
 * A write that would break a constraint of the company table. Nothing has been persisted when
 * this is thrown.
 */
public class CompanyConstraintException extends RuntimeException {

  public enum Reason {
    MISSING_FIELD,
    DUPLICATE_ID,
    INTEGRITY
  }

  private final Reason reason;

  public CompanyConstraintException(Reason reason, String message) {
    this(reason, message, null);
  }

  public CompanyConstraintException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public static CompanyConstraintException missingField(String field) {
    return new CompanyConstraintException(Reason.MISSING_FIELD, field + " must be provided");
  }

  public static CompanyConstraintException duplicateId(int id) {
    return new CompanyConstraintException(Reason.DUPLICATE_ID,
        "Company with id " + id + " already exists");
  }

  public Reason reason() {
    return reason;
  }
}
