package com.example.home_view.model;

public record BillingInfo(boolean showBilling, boolean showPlans) {

  public static final BillingInfo HIDDEN = new BillingInfo(false, false);
}
