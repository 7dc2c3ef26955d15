package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.ObservableUri;

/** An image or other blob extracted from a body; {@code blob} is base64. */
public record BodyMedia(
    ObservableUri uri, String description, String placeholder, String mimeType, String blob)
    implements Observation {}
