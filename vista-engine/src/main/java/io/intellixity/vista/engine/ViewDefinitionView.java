package io.intellixity.vista.engine;

import java.util.List;
import java.util.Map;

public record ViewDefinitionView(
    String viewId,
    String name,
    String rootTable,
    Map<String, Object> root,
    List<Map<String, Object>> controls
) {}
