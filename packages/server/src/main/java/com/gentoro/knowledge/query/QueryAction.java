package com.gentoro.knowledge.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.knowledge.exception.ValidationException;
import com.gentoro.knowledge.resolve.LoadMode;
import java.util.List;

/**
 * One action of a batch.
 *
 * <ul>
 *   <li>{@code resources/load}: the resource view, plus the bundles of the affordances listed in
 *       {@code observe} and, when {@code expand_depth > 0}, related resources;
 *   <li>{@code resources/observe}: {@code uri} names an affordance, a chunk or a media item, which
 *       is returned;
 *   <li>{@code resources/attachment}: stores {@code text} as the {@code $plain} content of the
 *       resource unless the connector provides content of its own.
 * </ul>
 */
public record QueryAction(
    QueryMethod method,
    String uri,
    @JsonProperty("load_mode") LoadMode loadMode,
    @JsonProperty("expand_depth") Integer expandDepth,
    @JsonProperty("expand_mode") LoadMode expandMode,
    List<String> observe,
    String name,
    @JsonProperty("mime_type") String mimeType,
    String description,
    String text) {

  public QueryAction {
    if (method == null) {
      throw new ValidationException("A query action needs a method");
    }
    if (uri == null || uri.isBlank()) {
      throw new ValidationException("A query action needs a uri");
    }
    loadMode = loadMode == null ? LoadMode.AUTO : loadMode;
    expandDepth = expandDepth == null ? 0 : expandDepth;
    if (expandDepth < 0) {
      throw new ValidationException("expand_depth must not be negative: " + expandDepth);
    }
    expandMode = expandMode == null ? LoadMode.NONE : expandMode;
    observe = observe == null ? List.of() : List.copyOf(observe);
    if (method == QueryMethod.ATTACHMENT && text == null) {
      throw new ValidationException("An attachment needs a text");
    }
  }

  public static QueryAction load(String uri, LoadMode loadMode, String... observe) {
    return new QueryAction(
        QueryMethod.LOAD, uri, loadMode, 0, null, List.of(observe), null, null, null, null);
  }

  public static QueryAction observe(String uri, LoadMode loadMode) {
    return new QueryAction(
        QueryMethod.OBSERVE, uri, loadMode, 0, null, null, null, null, null, null);
  }

  public static QueryAction attachment(
      String uri, String name, String mimeType, String description, String text) {
    return new QueryAction(
        QueryMethod.ATTACHMENT, uri, null, 0, null, null, name, mimeType, description, text);
  }

  public QueryAction withExpansion(int depth, LoadMode mode) {
    return new QueryAction(
        method, uri, loadMode, depth, mode, observe, name, mimeType, description, text);
  }
}
