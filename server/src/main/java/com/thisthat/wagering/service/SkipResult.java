package com.thisthat.wagering.service;

import lombok.Value;

import java.time.Instant;

@Value
public class SkipResult {
    boolean success;
    Instant expiresAt;
}
