package com.example.home_view.model;

public enum TutorialStatus {
  WAITING,
  STARTED,
  FINISHED
}
