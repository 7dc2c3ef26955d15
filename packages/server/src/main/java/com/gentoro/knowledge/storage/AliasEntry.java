package com.gentoro.knowledge.storage;

import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.ResourceUri;

/** Maps an external URI to the resource it was resolved to. */
public record AliasEntry(ExternalUri alias, ResourceUri resource, Locator locator) {}
