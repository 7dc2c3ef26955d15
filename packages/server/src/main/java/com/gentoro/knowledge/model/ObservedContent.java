package com.gentoro.knowledge.model;

/** What a connector hands back from an observation: a raw {@link Fragment} or a ready {@link Bundle}. */
public interface ObservedContent {}
