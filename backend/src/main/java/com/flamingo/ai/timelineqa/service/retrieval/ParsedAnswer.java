package com.flamingo.ai.timelineqa.service.retrieval;

import java.util.List;

/**
 * Generated answer split into prose and citations.
 *
 * @param citedIds cited ids that were among the retrieved episodes, in citation order
 * @param droppedIds cited ids that were not retrieved and were therefore discarded
 */
public record ParsedAnswer(String answer, List<String> citedIds, List<String> droppedIds) {}
