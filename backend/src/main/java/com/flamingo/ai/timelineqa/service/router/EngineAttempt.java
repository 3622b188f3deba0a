package com.flamingo.ai.timelineqa.service.router;

import com.flamingo.ai.timelineqa.domain.enums.EngineType;
import com.flamingo.ai.timelineqa.domain.enums.ErrorKind;

/** One dispatch of a question to an engine. {@code errorKind} is null on success. */
public record EngineAttempt(
    EngineType engine, boolean success, ErrorKind errorKind, String message, long durationMs) {}
