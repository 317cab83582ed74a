package com.sqlopt.optimizer.dto.rewrite;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/** Risk the model attaches to its own rewrite. */
public enum RiskLevel {
  LOW("low"),
  MEDIUM("medium"),
  HIGH("high"),
  UNKNOWN("unknown");

  private final String value;

  RiskLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Maps a value the model is allowed to emit. {@code unknown} is reserved for a missing field
   * and is not accepted here.
   */
  public static Optional<RiskLevel> fromModelValue(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (RiskLevel level : values()) {
      if (level != UNKNOWN && level.value.equals(normalized)) {
        return Optional.of(level);
      }
    }
    return Optional.empty();
  }
}
