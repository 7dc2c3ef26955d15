package com.gentoro.knowledge.model;

public enum RelationType {
  PARENT("parent"),
  LINK("link"),
  EMBED("embed"),
  MISC("misc");

  private final String tag;

  RelationType(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }
}
