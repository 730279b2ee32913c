package com.thisthat.wagering.entity;

public enum HoldStatus {
    ACTIVE,
    RELEASED,
    CAPTURED
}
