package com.gentoro.knowledge.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.knowledge.exception.SerializationException;
import com.gentoro.knowledge.model.Bundle;
import com.gentoro.knowledge.model.Relation;
import com.gentoro.knowledge.model.ResourceHistory;
import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.ResourceUri;
import com.gentoro.knowledge.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Persists resource histories, bundles, aliases and relations on top of an {@link ObjectStorage}.
 *
 * <p>{@link #commit(ResolutionCommit)} writes the history last, so a reader that finds a history
 * also finds every bundle and relation it refers to.
 */
public class BundleStore {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(BundleStore.class);
  private static final byte[] MARKER = new byte[0];

  private final ObjectStorage storage;
  private final StorageKeys keys;
  private final ObjectMapper mapper;

  public BundleStore(ObjectStorage storage, StorageKeys keys, Collection<Class<?>> locatorTypes) {
    this.storage = storage;
    this.keys = keys;
    this.mapper = JacksonUtility.newYamlMapper();
    for (Class<?> type : locatorTypes) {
      mapper.registerSubtypes(type);
    }
  }

  public StorageKeys getKeys() {
    return keys;
  }

  public ResourceHistory loadHistory(ResourceUri uri) {
    return read(keys.resource(uri), ResourceHistory.class);
  }

  public Bundle loadBundle(ResourceUri uri, Affordance affordance) {
    return read(keys.observed(uri, affordance), Bundle.class);
  }

  public AliasEntry loadAlias(ExternalUri alias) {
    return read(keys.alias(alias), AliasEntry.class);
  }

  public boolean hasHistory(ResourceUri uri) {
    return storage.exists(keys.resource(uri));
  }

  public void saveAlias(AliasEntry entry) {
    write(keys.alias(entry.alias()), entry);
  }

  public void commit(ResolutionCommit commit) {
    if (commit.isEmpty()) {
      return;
    }
    for (Bundle bundle : commit.bundles()) {
      write(keys.observed(commit.uri(), bundle.uri().affordance()), bundle);
    }
    for (Relation relation : commit.savedRelations()) {
      saveRelation(relation);
    }
    for (AliasEntry alias : commit.savedAliases()) {
      saveAlias(alias);
    }
    for (Relation relation : commit.removedRelations()) {
      removeRelation(relation);
    }
    for (ExternalUri alias : commit.removedAliases()) {
      storage.delete(keys.alias(alias));
    }
    if (commit.history() != null) {
      write(keys.resource(commit.uri()), commit.history());
    }
    log.debug(
        "Committed {}: {} bundle(s), +{}/-{} relation(s), +{}/-{} alias(es){}",
        commit.uri(),
        commit.bundles().size(),
        commit.savedRelations().size(),
        commit.removedRelations().size(),
        commit.savedAliases().size(),
        commit.removedAliases().size(),
        commit.history() == null ? "" : ", history updated");
  }

  /** Relations involving {@code uri} from either end, ordered by id. */
  public List<Relation> listRelations(ResourceUri uri) {
    List<Relation> relations = new ArrayList<>();
    for (String refKey : storage.list(keys.relationReferences(uri))) {
      String id = StorageKeys.relationIdOf(refKey);
      Relation relation = read(keys.relationDefinition(id), Relation.class);
      if (relation == null) {
        log.warn("Dangling relation reference {} for {}", id, uri);
        continue;
      }
      relations.add(relation);
    }
    relations.sort(Comparator.comparing(Relation::uniqueId));
    return relations;
  }

  void saveRelation(Relation relation) {
    String id = relation.uniqueId();
    write(keys.relationDefinition(id), relation);
    for (ResourceUri node : relation.nodes()) {
      storage.put(keys.relationReference(node, id), MARKER);
    }
  }

  void removeRelation(Relation relation) {
    String id = relation.uniqueId();
    for (ResourceUri node : relation.nodes()) {
      storage.delete(keys.relationReference(node, id));
    }
    storage.delete(keys.relationDefinition(id));
  }

  private <T> T read(String key, Class<T> type) {
    byte[] data = storage.get(key);
    if (data == null) {
      return null;
    }
    try {
      return mapper.readValue(data, type);
    } catch (IOException e) {
      throw new SerializationException("Unable to read " + type.getSimpleName() + " at " + key, e);
    }
  }

  private void write(String key, Object value) {
    byte[] data;
    try {
      data = mapper.writeValueAsBytes(value);
    } catch (IOException e) {
      throw new SerializationException("Unable to serialize value for " + key, e);
    }
    storage.put(key, data);
  }
}
