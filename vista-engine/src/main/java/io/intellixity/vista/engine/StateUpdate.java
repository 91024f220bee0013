package io.intellixity.vista.engine;

/** Body of a state write; a null part keeps the persisted value. */
public record StateUpdate(Object controlsSource, Object tableStateSource) {}
