package com.dcruver.beliefgraph.domain;

import lombok.Value;

import java.util.List;

/**
 * CONTAINS hierarchy below a node, cut off at a maximum depth.
 */
@Value
public class ModuleTree {
    Node node;
    List<ModuleTree> children;

    public int size() {
        return 1 + children.stream().mapToInt(ModuleTree::size).sum();
    }
}
