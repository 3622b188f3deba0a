package com.flamingo.ai.timelineqa.agent.dto;

/**
 * Structured output from StructuredQueryAgent. LangChain4j deserializes the model's JSON response
 * into this record.
 */
public record GeneratedQuery(
    boolean answerable,
    String view,
    String sql,
    String reasoning // Optional: why the query answers the question
    ) {}
