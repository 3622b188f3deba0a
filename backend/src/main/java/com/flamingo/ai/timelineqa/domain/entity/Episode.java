package com.flamingo.ai.timelineqa.domain.entity;

import com.flamingo.ai.timelineqa.domain.converter.OffsetDateTimeConverter;
import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A single verbalized event from the personal timeline. Episodes are never modified once
 * created; a changed source record produces a new episode with the same provenance reference.
 */
@Entity
@Table(name = "episodes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(exclude = "verbalizedText")
public class Episode {

  /** Content-derived id, {@code ep_} followed by 32 hex characters. */
  @Id
  @Column(length = 35)
  @EqualsAndHashCode.Include
  private String id;

  @Column(nullable = false)
  @Convert(converter = OffsetDateTimeConverter.class)
  private OffsetDateTime timestamp;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String verbalizedText;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private SourceType sourceType;

  /** Reference back to the source record; unique across live episodes. */
  @Column(nullable = false, unique = true)
  private String provenanceRef;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }
}
