package com.realestate.compatibility.service;

public enum CoordinateSpace {
    PROJECTED,
    GEOGRAPHIC,
    UNDEFINED
}
