package io.intellixity.vista.spi;

import io.intellixity.vista.model.ViewDefinition;

public interface ViewDefinitionStore {

  /** @throws io.intellixity.vista.error.ViewNotFoundException when no view has this id */
  ViewDefinition load(String viewId);
}
