package com.gentoro.knowledge.query;

import java.util.List;

public record QueryRequest(List<QueryAction> actions) {
  public QueryRequest {
    actions = actions == null ? List.of() : List.copyOf(actions);
  }

  public static QueryRequest of(QueryAction... actions) {
    return new QueryRequest(List.of(actions));
  }
}
