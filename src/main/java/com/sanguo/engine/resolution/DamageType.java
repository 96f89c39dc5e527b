package com.sanguo.engine.resolution;

public enum DamageType {
    NORMAL,
    FIRE,
    THUNDER
}
