package com.example.inference.model;

import java.util.Locale;

public enum VerdictStatus {
  INCONCLUSIVE,
  WITHIN_THRESHOLD,
  BREACHED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
