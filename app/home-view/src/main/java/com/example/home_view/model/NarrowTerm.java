package com.example.home_view.model;

public record NarrowTerm(String operator, String operand) {

  public NarrowTerm {
    if (operator == null || operator.isBlank()) {
      throw new IllegalArgumentException("operator is required");
    }
    operand = operand == null ? "" : operand;
  }
}
