package org.calista.credence.defeat;

/** A node was made to attack itself. Raised when the edge is added. */
public class ReflexivityViolationException extends GraphConstructionException {

    private final String nodeId;

    public ReflexivityViolationException(String nodeId) {
        super("self-attack is not allowed: " + nodeId);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
