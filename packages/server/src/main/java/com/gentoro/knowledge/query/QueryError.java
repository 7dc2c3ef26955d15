package com.gentoro.knowledge.query;

import com.gentoro.knowledge.exception.ErrorDetails;

/** A reference of the request that could not be served at all. */
public record QueryError(String uri, ErrorDetails error) {}
