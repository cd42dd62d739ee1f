package com.realestate.compatibility.engine;

import lombok.Value;

@Value
public class ParcelScore {
    int parcelId;
    int compatScore;
}
