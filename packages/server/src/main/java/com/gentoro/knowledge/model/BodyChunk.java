package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.ObservableUri;

public record BodyChunk(ObservableUri uri, String description, int numTokens, String text)
    implements Observation {}
