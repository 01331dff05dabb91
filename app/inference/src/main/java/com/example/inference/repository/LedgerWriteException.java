package com.example.inference.repository;

public class LedgerWriteException extends RuntimeException {
  public LedgerWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
