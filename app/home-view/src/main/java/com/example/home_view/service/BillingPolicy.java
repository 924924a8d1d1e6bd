/*
 * どこで: home-view サービス層
 * 何を: billing / plans メニューの表示可否を決める
 * なぜ: 課金状態の参照を 1 か所に閉じ込め、snapshot 内で値を再計算しないため
 */
package com.example.home_view.service;

import com.example.home_view.model.BillingCustomerRecord;
import com.example.home_view.model.BillingInfo;
import com.example.home_view.model.Identity;
import com.example.home_view.model.PlanType;
import com.example.home_view.repository.BillingCustomerRepository;
import com.example.home_view.repository.CustomerPlanRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BillingPolicy {

  private final BillingCustomerRepository billingCustomerRepository;
  private final CustomerPlanRepository customerPlanRepository;

  public BillingInfo evaluate(@Nullable Identity identity, boolean corporateEnabled) {
    if (!corporateEnabled || identity == null) {
      return BillingInfo.HIDDEN;
    }
    final boolean showBilling = identity.billingAccess() && hasBillingToShow(identity);
    final boolean showPlans =
        !identity.guest() && identity.realm().planType() == PlanType.LIMITED;
    return new BillingInfo(showBilling, showPlans);
  }

  // customer が無いのは正常系。請求対象なしとして扱う
  private boolean hasBillingToShow(Identity identity) {
    final Optional<BillingCustomerRecord> customer =
        billingCustomerRepository.findByRealmId(identity.realm().realmId());
    if (customer.isEmpty()) {
      return false;
    }
    if (customer.get().sponsorshipPending()) {
      return true;
    }
    return customerPlanRepository.existsByCustomerId(customer.get().customerId());
  }
}
