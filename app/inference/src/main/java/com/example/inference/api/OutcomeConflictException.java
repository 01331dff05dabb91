package com.example.inference.api;

public class OutcomeConflictException extends RuntimeException {
  public OutcomeConflictException(String requestId) {
    super("outcome already recorded with a different label for request_id=" + requestId);
  }
}
