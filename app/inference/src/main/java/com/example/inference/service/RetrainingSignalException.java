package com.example.inference.service;

public class RetrainingSignalException extends RuntimeException {
  public RetrainingSignalException(String message, Throwable cause) {
    super(message, cause);
  }
}
