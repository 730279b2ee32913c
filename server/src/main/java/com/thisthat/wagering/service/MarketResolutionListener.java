package com.thisthat.wagering.service;

import com.thisthat.wagering.config.AsyncConfig;
import com.thisthat.wagering.exception.SettlementIncompleteException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Settles a market as soon as its resolution is published. Anything left pending after a
 * failure is picked up by the settlement sweep.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketResolutionListener {

    private final PositionSettlementService positionSettlementService;

    @Async(AsyncConfig.SETTLEMENT_EXECUTOR)
    @EventListener
    public void onMarketResolved(MarketResolvedEvent event) {
        log.info("Market resolved: marketId={}, resolution={}", event.getMarketId(), event.getResolution());
        try {
            positionSettlementService.settlePositionsForMarket(event.getMarketId(), event.getResolution());
        } catch (SettlementIncompleteException e) {
            log.warn("Settlement incomplete, left for the sweep: marketId={}, failedBets={}",
                    event.getMarketId(), e.getFailedBetIds());
        } catch (RuntimeException e) {
            log.error("Settlement failed, left for the sweep: marketId={}, error={}",
                    event.getMarketId(), e.getMessage(), e);
        }
    }
}
