package com.flamingo.ai.timelineqa.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Kinds of personal source records that can be verbalized into episodes. */
public enum SourceType {
  /** Social media post. */
  POST,

  /** Photo with caption metadata. */
  PHOTO,

  /** Purchase of an item (books, tickets, etc.). */
  PURCHASE,

  /** Health or activity log entry. */
  WORKOUT,

  /** Visit to a place. */
  PLACE_VISIT;

  /**
   * Resolves a source type from its external name, tolerating case and dash/space separators.
   *
   * @param name external name such as {@code place_visit} or {@code Place-Visit}
   * @return the matching type, or empty when the name is unknown
   */
  public static Optional<SourceType> fromName(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    String normalized = name.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
    for (SourceType type : values()) {
      if (type.name().equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
