package org.calista.credence.defeat;

/**
 * Thrown while building an {@link AttackGraph}: unknown endpoints, duplicate ids, or a
 * claim used as an attacker.
 */
public class GraphConstructionException extends IllegalArgumentException {

    public GraphConstructionException(String message) {
        super(message);
    }
}
