package com.example.inference.api;

public class DriftEvaluationInProgressException extends RuntimeException {
  public DriftEvaluationInProgressException() {
    super("a drift evaluation cycle is already running");
  }
}
