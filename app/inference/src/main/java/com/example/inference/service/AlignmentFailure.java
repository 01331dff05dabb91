package com.example.inference.service;

import com.example.inference.api.ApiErrorCode;
import java.util.Locale;

public enum AlignmentFailure {
  MISSING_FEATURE(ApiErrorCode.MISSING_FEATURE),
  UNKNOWN_CATEGORY(ApiErrorCode.UNKNOWN_CATEGORY),
  INVALID_FEATURE_TYPE(ApiErrorCode.INVALID_FEATURE_TYPE);

  private final ApiErrorCode errorCode;

  AlignmentFailure(ApiErrorCode errorCode) {
    this.errorCode = errorCode;
  }

  public ApiErrorCode errorCode() {
    return errorCode;
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
