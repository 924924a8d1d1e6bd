/*
 * どこで: app/home-view/src/main/java/com/example/home_view/model/UserProfileRecord.java
 * 何を: user_profiles テーブル相当のレコード
 * なぜ: Repository と Identity 組み立てを分離するため
 */
package com.example.home_view.model;

public record UserProfileRecord(
    long userId,
    long realmId,
    String fullName,
    UserRole role,
    boolean billingAdmin,
    ColorScheme colorScheme,
    String defaultLanguage,
    TutorialStatus tutorialStatus,
    boolean active) {}
