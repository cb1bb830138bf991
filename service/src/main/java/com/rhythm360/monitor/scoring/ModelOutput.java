package com.rhythm360.monitor.scoring;

/** Label plus confidence of a single scorer. Confidence is clamped into [0, 1] on construction. */
public record ModelOutput(String label, double confidence) {
  public static final String INSUFFICIENT_DATA = "Insufficient Data";

  public ModelOutput {
    if (label == null || label.isBlank()) {
      throw new IllegalArgumentException("label must not be blank");
    }
    confidence = Double.isNaN(confidence) ? 0d : Math.max(0d, Math.min(1d, confidence));
  }

  /** Result of a scorer that had too little input to judge. */
  public static ModelOutput insufficientData() {
    return new ModelOutput(INSUFFICIENT_DATA, 0d);
  }

  public boolean is(String other) {
    return label.equals(other);
  }
}
