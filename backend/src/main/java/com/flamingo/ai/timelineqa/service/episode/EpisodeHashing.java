package com.flamingo.ai.timelineqa.service.episode;

import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Map;
import java.util.SortedMap;
import java.util.stream.Collectors;

/** SHA-256 based identities for episodes and episode sets. */
public final class EpisodeHashing {

  public static final String ID_PREFIX = "ep_";

  private static final int ID_HEX_LENGTH = 32;

  private EpisodeHashing() {}

  /**
   * Derives the episode id from the canonical form of a normalized record. Keys and values are
   * length-prefixed, so separators inside a value cannot make two records collide.
   */
  public static String episodeId(
      SourceType sourceType, Instant instant, SortedMap<String, String> fields) {
    StringBuilder canonical =
        new StringBuilder(sourceType.name()).append('|').append(instant).append('|');
    fields.forEach((key, value) -> appendPrefixed(appendPrefixed(canonical, key), value));
    return ID_PREFIX + sha256(canonical.toString()).substring(0, ID_HEX_LENGTH);
  }

  private static StringBuilder appendPrefixed(StringBuilder out, String value) {
    return out.append(value.length()).append(':').append(value);
  }

  /**
   * Content hash of an episode set. Ids are content-derived, so hashing the sorted ids covers
   * additions, removals and changes.
   */
  public static String contentHash(Collection<String> episodeIds) {
    return sha256(episodeIds.stream().sorted().collect(Collectors.joining("\n")));
  }

  /** Content hash of the given id-keyed map. */
  public static String contentHash(Map<String, ?> byId) {
    return contentHash(byId.keySet());
  }

  static String sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
