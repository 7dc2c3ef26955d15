package com.gentoro.knowledge.ingestion;

import com.gentoro.knowledge.connector.ObserveOptions;
import com.gentoro.knowledge.exception.UriFormatException;
import com.gentoro.knowledge.model.BodyChunk;
import com.gentoro.knowledge.model.Bundle;
import com.gentoro.knowledge.model.BundleBody;
import com.gentoro.knowledge.model.BundleCollection;
import com.gentoro.knowledge.model.Relation;
import com.gentoro.knowledge.model.RelationEmbed;
import com.gentoro.knowledge.model.RelationLink;
import com.gentoro.knowledge.model.RelationParent;
import com.gentoro.knowledge.uri.KnowledgeUri;
import com.gentoro.knowledge.uri.ResourceUri;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives relations from an ingested bundle, on top of those the connector reported. A node already
 * covered by another relation does not get a second, generic one. The result is sorted by relation
 * id.
 */
public class RelationExtractor {

  public List<Relation> extract(Bundle bundle, List<Relation> observed, ObserveOptions options) {
    ResourceUri self = bundle.uri().resourceUri();
    List<Relation> relations = new ArrayList<>(observed);

    if (options.relationsParent() && bundle instanceof BundleCollection collection) {
      Set<ResourceUri> children = new LinkedHashSet<>();
      for (ResourceUri child : collection.results()) {
        children.add(child.resourceUri());
      }
      for (ResourceUri child : children) {
        if (!child.equals(self) && !covered(relations, child)) {
          relations.add(new RelationParent(self, child));
        }
      }
    }

    if (options.relationsLink() && bundle instanceof BundleBody body) {
      Map<ResourceUri, Boolean> targets = new LinkedHashMap<>();
      for (BodyChunk chunk : body.chunks()) {
        for (MarkdownLinks.Link link : MarkdownLinks.find(chunk.text())) {
          ResourceUri target = knowledgeTarget(link.href());
          if (target != null) {
            targets.merge(target, link.embed(), Boolean::logicalAnd);
          }
        }
      }
      for (Map.Entry<ResourceUri, Boolean> target : targets.entrySet()) {
        ResourceUri uri = target.getKey();
        if (uri.equals(self) || covered(relations, uri)) continue;
        relations.add(
            target.getValue() ? new RelationEmbed(self, uri) : new RelationLink(self, uri));
      }
    }

    Map<String, Relation> unique = new LinkedHashMap<>();
    for (Relation relation : relations) {
      unique.putIfAbsent(relation.uniqueId(), relation);
    }
    List<Relation> sorted = new ArrayList<>(unique.values());
    sorted.sort(Comparator.comparing(Relation::uniqueId));
    return sorted;
  }

  private static boolean covered(List<Relation> relations, ResourceUri node) {
    for (Relation relation : relations) {
      if (relation.involves(node)) return true;
    }
    return false;
  }

  private static ResourceUri knowledgeTarget(String href) {
    if (!href.regionMatches(true, 0, KnowledgeUri.PREFIX, 0, KnowledgeUri.PREFIX.length())) {
      return null;
    }
    try {
      return KnowledgeUri.parse(href).resourceUri();
    } catch (UriFormatException e) {
      return null;
    }
  }
}
