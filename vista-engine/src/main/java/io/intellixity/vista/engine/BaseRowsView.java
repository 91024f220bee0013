package io.intellixity.vista.engine;

import io.intellixity.vista.query.MatrixRow;

import java.util.List;

/** Projected base rows of a table, without any user state applied. */
public record BaseRowsView(String viewId, String table, boolean restricted, List<MatrixRow> rows) {}
