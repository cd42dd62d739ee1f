package com.realestate.compatibility.engine;

import lombok.Value;

@Value
public class ScoredParcel {
    LandParcel parcel;
    int compatScore;
}
