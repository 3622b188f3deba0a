package com.flamingo.ai.timelineqa.service.structured;

/** Read-only access to the aggregate views. */
public interface StructuredStore {

  /**
   * Executes a validated query.
   *
   * @throws com.flamingo.ai.timelineqa.exception.QueryGenerationException with reason {@code
   *     EXECUTION_FAILED} if the store rejects or fails the query
   */
  TabularResult execute(ValidatedQuery query);

  /** Whether a table or view with this name exists in the store. */
  boolean viewExists(String viewName);
}
