package io.intellixity.vista.catalog;

import io.intellixity.vista.semantic.EntityMetadata;

import java.util.Optional;

public interface EntityCatalog {
  Optional<EntityMetadata> getEntity(String id);
}
