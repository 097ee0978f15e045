package com.verlumen.formuladiscovery.discovery;

import java.util.Locale;

/** The class of security a formula was discovered for. */
public enum SecurityType {
  STOCK,
  ETF;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static SecurityType fromString(String name) {
    return SecurityType.valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
