package com.browserpilot.core.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable lookup table from node id to node, built once at startup from the node beans.
 */
@Component
public class NodeRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final Map<String, RoutingNode> nodes;

    public NodeRegistry(List<RoutingNode> nodes) {
        var table = new LinkedHashMap<String, RoutingNode>();
        for (RoutingNode node : nodes) {
            RoutingNode previous = table.putIfAbsent(node.id(), node);
            if (previous != null) {
                throw new IllegalStateException("Duplicate routing node id '" + node.id() + "': "
                        + previous.getClass().getSimpleName() + " and " + node.getClass().getSimpleName());
            }
        }
        this.nodes = Map.copyOf(table);
        log.info("Registered {} routing nodes: {}", table.size(), table.keySet());
    }

    public RoutingNode get(String nodeId) {
        RoutingNode node = nodes.get(nodeId);
        if (node == null) {
            throw new UnknownNodeException(nodeId);
        }
        return node;
    }

    public ResumableNode resumable(String nodeId) {
        RoutingNode node = get(nodeId);
        if (!(node instanceof ResumableNode resumable)) {
            throw new IllegalStateException("Node '" + nodeId + "' cannot be resumed");
        }
        return resumable;
    }
}
