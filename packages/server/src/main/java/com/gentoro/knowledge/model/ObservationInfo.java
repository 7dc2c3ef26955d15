package com.gentoro.knowledge.model;

import com.gentoro.knowledge.uri.Observable;

/** Table-of-contents entry: an observable with its summary and size. */
public record ObservationInfo(Observable suffix, String description, Integer numTokens) {}
