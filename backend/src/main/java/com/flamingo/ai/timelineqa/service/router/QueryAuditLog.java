package com.flamingo.ai.timelineqa.service.router;

import com.flamingo.ai.timelineqa.config.QaConfig;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Bounded in-memory log of recent route traces, newest first. */
@Component
@RequiredArgsConstructor
public class QueryAuditLog {

  private final QaConfig qaConfig;
  private final Deque<RouteTrace> traces = new ArrayDeque<>();

  public synchronized void record(RouteTrace trace) {
    traces.addFirst(trace);
    int capacity = Math.max(1, qaConfig.getRouter().getAuditCapacity());
    while (traces.size() > capacity) {
      traces.removeLast();
    }
  }

  public synchronized List<RouteTrace> recent(int limit) {
    List<RouteTrace> result = new ArrayList<>(Math.min(Math.max(limit, 0), traces.size()));
    Iterator<RouteTrace> it = traces.iterator();
    while (it.hasNext() && result.size() < limit) {
      result.add(it.next());
    }
    return result;
  }

  public synchronized int size() {
    return traces.size();
  }
}
