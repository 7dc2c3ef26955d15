package com.gentoro.knowledge.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.gentoro.knowledge.uri.AffordanceUri;
import java.util.List;

/**
 * Immutable materialization of one affordance. A changed affordance produces a new bundle that
 * replaces the stored one as a whole.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = BundleBody.class, name = "body"),
  @JsonSubTypes.Type(value = BundleCollection.class, name = "collection"),
  @JsonSubTypes.Type(value = BundleFile.class, name = "file"),
  @JsonSubTypes.Type(value = BundlePlain.class, name = "plain")
})
public interface Bundle extends Observation, ObservedContent {
  @Override
  AffordanceUri uri();

  /** Short description of the content, when known. */
  String description();

  String mimeType();

  /** Summaries of the observations addressable inside this bundle. */
  List<ObservationInfo> tableOfContents();
}
