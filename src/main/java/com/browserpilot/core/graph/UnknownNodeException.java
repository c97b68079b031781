package com.browserpilot.core.graph;

/**
 * Thrown when a transition routes to a node id that is not registered.
 */
public class UnknownNodeException extends IllegalStateException {

    private final String nodeId;

    public UnknownNodeException(String nodeId) {
        super("No routing node registered under id '" + nodeId + "'");
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
