package com.gentoro.knowledge.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.knowledge.exception.ValidationException;

public enum QueryMethod {
  LOAD("resources/load"),
  OBSERVE("resources/observe"),
  ATTACHMENT("resources/attachment");

  private final String wireName;

  QueryMethod(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static QueryMethod parse(String value) {
    for (QueryMethod method : values()) {
      if (method.wireName.equals(value)) {
        return method;
      }
    }
    throw new ValidationException("Unknown query method: " + value);
  }
}
