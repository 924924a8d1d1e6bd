package com.example.home_view.model;

public record BillingCustomerRecord(long customerId, long realmId, boolean sponsorshipPending) {}
