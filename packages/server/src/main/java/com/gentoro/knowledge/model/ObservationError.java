package com.gentoro.knowledge.model;

import com.gentoro.knowledge.exception.ErrorDetails;
import com.gentoro.knowledge.uri.KnowledgeUri;

/** Stands in for an observation that could not be produced. */
public record ObservationError(KnowledgeUri uri, ErrorDetails error) implements Observation {}
