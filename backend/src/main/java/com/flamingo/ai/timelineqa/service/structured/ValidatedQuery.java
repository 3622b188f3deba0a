package com.flamingo.ai.timelineqa.service.structured;

/** A query that passed validation, together with the view it reads. */
public record ValidatedQuery(StructuredView view, String sql) {}
