package com.ospicorp.geosimple.db;

import java.util.ArrayList;
import java.util.List;

public record SchemaReport(
    boolean postgisInstalled,
    List<String> missingColumns,
    boolean triggerInstalled
) {

  public boolean complete() {
    return postgisInstalled && missingColumns.isEmpty() && triggerInstalled;
  }

  public List<String> missing() {
    List<String> missing = new ArrayList<>();
    if (!postgisInstalled) {
      missing.add("extension " + CompanySchemaVerifier.EXTENSION);
    }
    for (String column : missingColumns) {
      missing.add("column " + CompanySchemaVerifier.TABLE + '.' + column);
    }
    if (!triggerInstalled) {
      missing.add("trigger " + CompanySchemaVerifier.TRIGGER);
    }
    return missing;
  }
}
