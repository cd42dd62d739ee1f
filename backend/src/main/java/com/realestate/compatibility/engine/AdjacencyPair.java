package com.realestate.compatibility.engine;

import lombok.Value;

/**
 * Directed pair of distinct parcels lying within the adjacency distance of each other.
 * The left parcel is the one whose perspective is scored.
 */
@Value
public class AdjacencyPair {
    int leftId;
    String leftClass;
    int rightId;
    String rightClass;
}
