package com.retailai.recommender.dto.quality;

/** Quality risk tier, from least to most severe. */
public enum RiskLevel {
  OK(0),
  MONITOR(1),
  MEDIUM_RISK(2),
  HIGH_RISK(3);

  private final int severity;

  RiskLevel(int severity) {
    this.severity = severity;
  }

  public int getSeverity() {
    return severity;
  }

  /** Tiers that surface in the actionable alerts view. */
  public boolean isActionable() {
    return this == HIGH_RISK || this == MEDIUM_RISK;
  }
}
