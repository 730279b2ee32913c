package com.thisthat.wagering.job;

import com.thisthat.wagering.config.SchedulerConfig;
import com.thisthat.wagering.config.WageringProperties;
import com.thisthat.wagering.entity.BetStatus;
import com.thisthat.wagering.entity.MarketResolution;
import com.thisthat.wagering.entity.MarketState;
import com.thisthat.wagering.entity.MarketStatus;
import com.thisthat.wagering.exception.SettlementIncompleteException;
import com.thisthat.wagering.repositories.BetRepository;
import com.thisthat.wagering.repositories.MarketStateRepository;
import com.thisthat.wagering.service.PositionSettlementService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;

/**
 * Settlement sweep: settles every resolved or invalid market that still has pending bets.
 * Catches markets whose resolution event was missed and resumes incomplete settlements.
 */
@Slf4j
@Component
public class MarketSettlementJob extends SingleFlightJob {

    private final BetRepository betRepository;
    private final MarketStateRepository marketStateRepository;
    private final PositionSettlementService positionSettlementService;

    public MarketSettlementJob(BetRepository betRepository,
                               MarketStateRepository marketStateRepository,
                               PositionSettlementService positionSettlementService,
                               @Qualifier(SchedulerConfig.JOB_SCHEDULER) TaskScheduler scheduler,
                               WageringProperties properties) {
        super("market-settlement", scheduler, properties.getJobs().getMarketSettlement());
        this.betRepository = betRepository;
        this.marketStateRepository = marketStateRepository;
        this.positionSettlementService = positionSettlementService;
    }

    @Override
    protected void runCycle() {
        List<String> marketIds = betRepository.findMarketIdsWithStatus(BetStatus.PENDING);
        if (marketIds.isEmpty()) {
            return;
        }
        List<MarketState> settleable = marketStateRepository.findByIdInAndStatusIn(marketIds,
                EnumSet.of(MarketStatus.RESOLVED, MarketStatus.INVALID));

        int incomplete = 0;
        for (MarketState market : settleable) {
            MarketResolution resolution = resolutionOf(market);
            if (resolution == null) {
                log.warn("Resolved market has no outcome, skipping: marketId={}", market.getId());
                continue;
            }
            try {
                positionSettlementService.settlePositionsForMarket(market.getId(), resolution);
            } catch (SettlementIncompleteException e) {
                incomplete++;
                log.warn("Settlement incomplete, retrying next cycle: marketId={}, failedBets={}",
                        market.getId(), e.getFailedBetIds());
            }
        }
        log.info("Settlement sweep complete: marketsWithPendingBets={}, settleable={}, incomplete={}",
                marketIds.size(), settleable.size(), incomplete);
    }

    private static MarketResolution resolutionOf(MarketState market) {
        if (market.getStatus() == MarketStatus.INVALID) {
            return MarketResolution.INVALID;
        }
        return market.getResolution();
    }
}
