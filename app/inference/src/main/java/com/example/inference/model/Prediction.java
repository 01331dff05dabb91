package com.example.inference.model;

public record Prediction(int label, double probability) {

  public Prediction {
    if (label != 0 && label != 1) {
      throw new IllegalArgumentException("label must be 0 or 1");
    }
    if (!(probability >= 0.0 && probability <= 1.0)) {
      throw new IllegalArgumentException("probability must be within [0, 1]");
    }
  }
}
