package com.thisthat.wagering.service;

import com.thisthat.wagering.engine.PayoutPricing;
import com.thisthat.wagering.entity.Bet;
import com.thisthat.wagering.entity.BetStatus;
import com.thisthat.wagering.entity.CloseReason;
import com.thisthat.wagering.entity.MarketResolution;
import com.thisthat.wagering.entity.Money;
import com.thisthat.wagering.entity.TransactionType;
import com.thisthat.wagering.exception.SettlementConflictException;
import com.thisthat.wagering.exception.SettlementIncompleteException;
import com.thisthat.wagering.exception.ValidationException;
import com.thisthat.wagering.repositories.BetRepository;
import com.thisthat.wagering.repositories.UserAccountRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Settles every pending bet of a resolved market.
 *
 * Each bet is settled in its own transaction: the conditional PENDING → terminal update comes
 * first, then the ledger credit and PnL change. A bet that is no longer pending is skipped, so
 * re-running settlement (after a crash, or concurrently) never pays twice.
 *
 * INVALID  → CANCELLED, stake refunded
 * winner   → WON, payout credited, PnL += payout - stake, biggestWin raised to the profit
 * loser    → LOST, PnL -= stake
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionSettlementService {

    private final BetRepository betRepository;
    private final LedgerService ledgerService;
    private final UserAccountRepository userAccountRepository;
    private final PayoutPricing payoutPricing;
    private final StoreRetries storeRetries;
    private final TransactionOperations transactionOperations;
    private final Clock clock;

    private record BetOutcome(BetStatus status, Money credited) {
    }

    /**
     * @throws SettlementIncompleteException some bets failed; the rest are settled and a re-run
     *         picks up only the failed ones
     */
    public SettlementResult settlePositionsForMarket(String marketId, MarketResolution resolution) {
        if (marketId == null || marketId.isBlank() || resolution == null) {
            throw new ValidationException("marketId and resolution are required");
        }

        List<Bet> pending = betRepository.findByMarketIdAndStatus(marketId, BetStatus.PENDING);
        if (pending.isEmpty()) {
            log.info("No pending bets to settle: marketId={}, resolution={}", marketId, resolution);
            return SettlementResult.noop(marketId, resolution);
        }
        log.info("Settling market: marketId={}, resolution={}, pendingBets={}", marketId, resolution, pending.size());

        int won = 0;
        int lost = 0;
        int refunded = 0;
        int alreadySettled = 0;
        Money totalPayout = Money.ZERO;
        List<String> failed = new ArrayList<>();
        RuntimeException firstFailure = null;

        for (Bet bet : pending) {
            try {
                BetOutcome outcome = storeRetries.execute("settle-bet",
                        () -> transactionOperations.execute(status -> settleBet(bet, resolution)));
                switch (outcome.status()) {
                    case WON -> won++;
                    case LOST -> lost++;
                    case CANCELLED -> refunded++;
                    default -> throw new IllegalStateException("Unexpected settlement status " + outcome.status());
                }
                totalPayout = totalPayout.add(outcome.credited());
            } catch (SettlementConflictException e) {
                alreadySettled++;
                log.info("Bet already settled by another run: betId={}, marketId={}", bet.getId(), marketId);
            } catch (RuntimeException e) {
                failed.add(bet.getId());
                if (firstFailure == null) {
                    firstFailure = e;
                }
                log.error("Failed to settle bet: betId={}, marketId={}, error={}", bet.getId(), marketId, e.getMessage(), e);
            }
        }

        SettlementResult result = SettlementResult.builder()
                .marketId(marketId)
                .resolution(resolution)
                .settled(won + lost + refunded)
                .won(won)
                .lost(lost)
                .refunded(refunded)
                .alreadySettled(alreadySettled)
                .failed(failed.size())
                .totalPayout(totalPayout.toBigDecimal())
                .build();

        if (!failed.isEmpty()) {
            throw new SettlementIncompleteException(marketId, result, failed, firstFailure);
        }
        log.info("Market settled: marketId={}, settled={}, won={}, lost={}, refunded={}, alreadySettled={}, totalPayout={}",
                marketId, result.getSettled(), won, lost, refunded, alreadySettled, result.getTotalPayout());
        return result;
    }

    private BetOutcome settleBet(Bet bet, MarketResolution resolution) {
        Instant now = clock.instant();
        Money stake = Money.of(bet.getAmount());

        if (resolution == MarketResolution.INVALID) {
            transition(bet, BetStatus.CANCELLED, stake, CloseReason.REFUNDED, now);
            ledgerService.credit(bet.getUserId(), stake.toBigDecimal(), TransactionType.REFUND, bet.getId());
            return new BetOutcome(BetStatus.CANCELLED, stake);
        }

        if (resolution.isWinningSide(bet.getSide())) {
            Money payout = payoutPricing.payoutFor(bet);
            transition(bet, BetStatus.WON, payout, null, now);
            if (payout.isPositive()) {
                ledgerService.credit(bet.getUserId(), payout.toBigDecimal(), TransactionType.PAYOUT, bet.getId());
            }
            Money profit = payout.subtract(stake);
            userAccountRepository.recordActivity(bet.getUserId(), profit.toBigDecimal(), BigDecimal.ZERO);
            if (profit.isPositive()) {
                userAccountRepository.recordBiggestWin(bet.getUserId(), profit.toBigDecimal());
            }
            return new BetOutcome(BetStatus.WON, payout);
        }

        transition(bet, BetStatus.LOST, Money.ZERO, null, now);
        userAccountRepository.recordActivity(bet.getUserId(), stake.negate().toBigDecimal(), BigDecimal.ZERO);
        return new BetOutcome(BetStatus.LOST, Money.ZERO);
    }

    private void transition(Bet bet, BetStatus target, Money actualPayout, CloseReason reason, Instant now) {
        if (!bet.getStatus().canTransitionTo(target)) {
            throw new SettlementConflictException(bet.getId());
        }
        if (betRepository.closeIfPending(bet.getId(), target, actualPayout.toBigDecimal(), reason, now) == 0) {
            throw new SettlementConflictException(bet.getId());
        }
        log.debug("Bet settled: betId={}, userId={}, status={}, actualPayout={}",
                bet.getId(), bet.getUserId(), target, actualPayout);
    }
}
