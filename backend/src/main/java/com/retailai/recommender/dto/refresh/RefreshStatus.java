package com.retailai.recommender.dto.refresh;

public enum RefreshStatus {
  RUNNING,
  COMPLETED,
  COMPLETED_WITH_FAILURES,
  CANCELLED,
  FAILED,
  SKIPPED_ALREADY_RUNNING
}
