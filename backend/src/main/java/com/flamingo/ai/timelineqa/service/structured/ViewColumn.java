package com.flamingo.ai.timelineqa.service.structured;

/** A column of a structured view. */
public record ViewColumn(String name, String type, String description) {}
