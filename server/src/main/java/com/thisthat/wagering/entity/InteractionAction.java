package com.thisthat.wagering.entity;

public enum InteractionAction {
    SKIP
}
