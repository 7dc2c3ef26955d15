package com.gentoro.knowledge.storage;

import com.gentoro.knowledge.model.Bundle;
import com.gentoro.knowledge.model.Relation;
import com.gentoro.knowledge.model.ResourceHistory;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.ResourceUri;
import java.util.List;

/**
 * Everything one resolution writes. A {@code null} history leaves the stored history untouched.
 */
public record ResolutionCommit(
    ResourceUri uri,
    ResourceHistory history,
    List<Bundle> bundles,
    List<Relation> savedRelations,
    List<Relation> removedRelations,
    List<AliasEntry> savedAliases,
    List<ExternalUri> removedAliases) {

  public ResolutionCommit {
    bundles = bundles == null ? List.of() : List.copyOf(bundles);
    savedRelations = savedRelations == null ? List.of() : List.copyOf(savedRelations);
    removedRelations = removedRelations == null ? List.of() : List.copyOf(removedRelations);
    savedAliases = savedAliases == null ? List.of() : List.copyOf(savedAliases);
    removedAliases = removedAliases == null ? List.of() : List.copyOf(removedAliases);
  }

  public boolean isEmpty() {
    return history == null
        && bundles.isEmpty()
        && savedRelations.isEmpty()
        && removedRelations.isEmpty()
        && savedAliases.isEmpty()
        && removedAliases.isEmpty();
  }
}
