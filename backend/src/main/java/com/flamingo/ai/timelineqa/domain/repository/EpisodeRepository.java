package com.flamingo.ai.timelineqa.domain.repository;

import com.flamingo.ai.timelineqa.domain.entity.Episode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Episode entities. */
@Repository
public interface EpisodeRepository extends JpaRepository<Episode, String> {}
