package org.prossme.bpmn.autolayout.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Column index per node, plus the number of edge relaxations the traversal needed.
 */
public record LevelAssignment(Map<String, Integer> levels, int traversalSteps) {

    public LevelAssignment {
        levels = Collections.unmodifiableMap(new LinkedHashMap<>(levels));
    }

    public int levelOf(String nodeId) {
        return levels.getOrDefault(nodeId, 0);
    }

    public int maxLevel() {
        return levels.values().stream().mapToInt(Integer::intValue).max().orElse(-1);
    }
}
