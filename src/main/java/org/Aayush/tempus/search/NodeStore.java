package org.Aayush.tempus.search;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Append-only node arena for one search.
 *
 * <p>Node ids are indexes and stay stable for parent chains.</p>
 */
final class NodeStore {
    private final ObjectArrayList<SearchNode> nodes = new ObjectArrayList<>();

    /**
     * Appends one node and returns its stable id.
     */
    int add(SearchNode node) {
        int nodeId = nodes.size();
        nodes.add(node);
        return nodeId;
    }

    SearchNode get(int nodeId) {
        return nodes.get(nodeId);
    }

    int size() {
        return nodes.size();
    }
}
