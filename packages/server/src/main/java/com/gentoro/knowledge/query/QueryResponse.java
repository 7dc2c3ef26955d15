package com.gentoro.knowledge.query;

import com.gentoro.knowledge.model.Observation;
import com.gentoro.knowledge.model.Relation;
import com.gentoro.knowledge.model.ResourceView;
import java.util.List;

public record QueryResponse(
    List<ResourceView> resources,
    List<Observation> observations,
    List<Relation> relations,
    List<QueryError> errors) {

  public QueryResponse {
    resources = resources == null ? List.of() : List.copyOf(resources);
    observations = observations == null ? List.of() : List.copyOf(observations);
    relations = relations == null ? List.of() : List.copyOf(relations);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }
}
