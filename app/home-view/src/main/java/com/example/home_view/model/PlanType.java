package com.example.home_view.model;

public enum PlanType {
  SELF_HOSTED,
  LIMITED,
  STANDARD,
  STANDARD_FREE
}
