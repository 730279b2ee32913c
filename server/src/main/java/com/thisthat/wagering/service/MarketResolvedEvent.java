package com.thisthat.wagering.service;

import com.thisthat.wagering.entity.MarketResolution;
import lombok.Value;

/**
 * Published by market ingestion when a market reaches its final outcome.
 */
@Value
public class MarketResolvedEvent {
    String marketId;
    MarketResolution resolution;
}
