package com.gentoro.knowledge.connector;

/**
 * Ingestion switches chosen by the connector for one observation.
 *
 * @param fields derive descriptions for body chunks and media
 * @param relationsLink turn knowledge-URI links of a body into link and embed relations
 * @param relationsParent turn collection results into parent relations
 */
public record ObserveOptions(boolean fields, boolean relationsLink, boolean relationsParent) {
  public static final ObserveOptions DEFAULT = new ObserveOptions(true, false, false);

  public ObserveOptions withRelationsLink(boolean value) {
    return new ObserveOptions(fields, value, relationsParent);
  }

  public ObserveOptions withRelationsParent(boolean value) {
    return new ObserveOptions(fields, relationsLink, value);
  }
}
