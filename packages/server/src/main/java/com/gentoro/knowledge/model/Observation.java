package com.gentoro.knowledge.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.gentoro.knowledge.uri.KnowledgeUri;

/** One item of content returned to a caller: a bundle, a piece of a bundle, or an error. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = BundleBody.class, name = "body"),
  @JsonSubTypes.Type(value = BundleCollection.class, name = "collection"),
  @JsonSubTypes.Type(value = BundleFile.class, name = "file"),
  @JsonSubTypes.Type(value = BundlePlain.class, name = "plain"),
  @JsonSubTypes.Type(value = BodyChunk.class, name = "chunk"),
  @JsonSubTypes.Type(value = BodyMedia.class, name = "media"),
  @JsonSubTypes.Type(value = ObservationError.class, name = "error")
})
public interface Observation {
  KnowledgeUri uri();
}
