package com.realestate.compatibility.engine;

import lombok.Value;

import java.util.OptionalInt;

/**
 * Adjacency pair with the matrix lookup applied. An empty score means the class
 * pair was not present in the matrix.
 */
@Value
public class ScoredPair {
    AdjacencyPair pair;
    OptionalInt score;

    public int getLeftId() {
        return pair.getLeftId();
    }

    public boolean isResolved() {
        return score.isPresent();
    }
}
