package com.thisthat.wagering.service;

import com.thisthat.wagering.engine.PayoutPricing;
import com.thisthat.wagering.entity.Bet;
import com.thisthat.wagering.entity.BetRequest;
import com.thisthat.wagering.entity.BetStatus;
import com.thisthat.wagering.entity.CloseReason;
import com.thisthat.wagering.entity.MarketState;
import com.thisthat.wagering.entity.MarketStatus;
import com.thisthat.wagering.entity.Money;
import com.thisthat.wagering.entity.TransactionType;
import com.thisthat.wagering.exception.DuplicateRequestException;
import com.thisthat.wagering.exception.MarketNotOpenException;
import com.thisthat.wagering.exception.NotFoundException;
import com.thisthat.wagering.exception.PositionNotOpenException;
import com.thisthat.wagering.exception.ValidationException;
import com.thisthat.wagering.market.MarketDirectory;
import com.thisthat.wagering.repositories.BetRepository;
import com.thisthat.wagering.repositories.UserAccountRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bet lifecycle on the request path: placement and early sale.
 *
 * Placement Flow:
 * 1. Validate the request shape (BetValidator)
 * 2. Return the existing bet for a repeated idempotency key
 * 3. Resolve the market with a bounded lookup, require OPEN and unexpired
 * 4. Lock in odds and potential payout (PayoutPricing)
 * 5. In one transaction: debit the stake, record volume, insert the PENDING bet
 * 6. Clear any skip the user had on the market
 *
 * CRITICAL PROPERTIES:
 * - Idempotent: a repeated key returns the existing bet with no second debit
 * - Atomic: the debit and the bet row commit together or not at all
 * - Fail closed: no bet without fresh market state
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BettingService {

    private final BetRepository betRepository;
    private final BetValidator betValidator;
    private final LedgerService ledgerService;
    private final UserAccountRepository userAccountRepository;
    private final MarketDirectory marketDirectory;
    private final PayoutPricing payoutPricing;
    private final MarketSkipService marketSkipService;
    private final StoreRetries storeRetries;
    private final TransactionOperations transactionOperations;
    private final Clock clock;

    /**
     * Place a bet on one side of an open market.
     *
     * @return the new PENDING bet, or the existing bet for a repeated idempotency key
     */
    public Bet placeBet(BetRequest request) {
        BetValidator.ValidationResult validation = betValidator.validate(request);
        if (!validation.isValid()) {
            throw new ValidationException(validation.getErrors());
        }

        String userId = request.getUserId();
        String key = request.getIdempotencyKey();

        // IDEMPOTENCY CHECK: Return existing bet if duplicate
        if (key != null) {
            Optional<Bet> existing = betRepository.findByUserIdAndIdempotencyKey(userId, key);
            if (existing.isPresent()) {
                log.info("Duplicate bet request, returning existing bet: userId={}, idempotencyKey={}, betId={}",
                        userId, key, existing.get().getId());
                return existing.get();
            }
        }

        Instant now = clock.instant();
        MarketState market = requireOpenMarket(request.getMarketId(), now);

        BigDecimal odds = payoutPricing.oddsFor(market, request.getSide());
        if (odds == null || odds.signum() <= 0 || odds.compareTo(BigDecimal.ONE) > 0) {
            throw new MarketNotOpenException(market.getId(), "no tradable odds for " + request.getSide());
        }

        Money stake = Money.of(request.getAmount());
        String betId = betIdFor(userId, key);
        Bet bet = Bet.builder()
                .id(betId)
                .userId(userId)
                .marketId(market.getId())
                .side(request.getSide())
                .amount(stake.toBigDecimal())
                .oddsAtBet(odds)
                .potentialPayout(payoutPricing.potentialPayout(stake, odds).toBigDecimal())
                .idempotencyKey(key)
                .status(BetStatus.PENDING)
                .createdAt(now)
                .build();

        Bet placed;
        try {
            placed = storeRetries.execute("place-bet", () -> transactionOperations.execute(status -> {
                ledgerService.debit(userId, stake.toBigDecimal(), TransactionType.BET, betId);
                userAccountRepository.recordActivity(userId, BigDecimal.ZERO, stake.toBigDecimal());
                return betRepository.insert(bet);
            }));
        } catch (DuplicateRequestException | DuplicateKeyException e) {
            // Race: a concurrent request with the same key committed first
            log.info("Concurrent duplicate bet request, returning existing bet: userId={}, idempotencyKey={}",
                    userId, key);
            return betRepository.findById(betId).orElseThrow(() -> e);
        }

        clearSkip(userId, market.getId());
        log.info("Bet placed: betId={}, userId={}, marketId={}, side={}, amount={}, odds={}, potentialPayout={}",
                placed.getId(), userId, market.getId(), placed.getSide(), stake, odds, placed.getPotentialPayout());
        return placed;
    }

    /**
     * Sell a pending position back before resolution. Only the full stake can be sold.
     *
     * @param amount stake to sell; null sells the whole position
     */
    public SaleResult sellPosition(String userId, String betId, BigDecimal amount) {
        Bet bet = betRepository.findById(betId)
                .filter(b -> b.isOwnedBy(userId))
                .orElseThrow(() -> new NotFoundException("bet", betId));
        if (!bet.getStatus().canTransitionTo(BetStatus.CANCELLED)) {
            throw new PositionNotOpenException(betId);
        }
        if (amount != null && amount.compareTo(bet.getAmount()) != 0) {
            throw new ValidationException("partial selling is not supported: sell the full stake of "
                    + bet.getAmount().toPlainString());
        }

        Instant now = clock.instant();
        MarketState market = requireOpenMarket(bet.getMarketId(), now);

        Money stake = Money.of(bet.getAmount());
        Money value = payoutPricing.saleValueFor(bet, market);

        BigDecimal newBalance = storeRetries.execute("sell-position", () -> transactionOperations.execute(status -> {
            if (betRepository.closeIfPending(betId, BetStatus.CANCELLED, value.toBigDecimal(), CloseReason.SOLD, now) == 0) {
                throw new PositionNotOpenException(betId);
            }
            userAccountRepository.recordActivity(userId, value.subtract(stake).toBigDecimal(), BigDecimal.ZERO);
            if (value.isPositive()) {
                return ledgerService.credit(userId, value.toBigDecimal(), TransactionType.POSITION_SOLD, betId)
                        .getBalanceAfter();
            }
            return ledgerService.getBalance(userId).getBalance();
        }));

        bet.setStatus(BetStatus.CANCELLED);
        bet.setCloseReason(CloseReason.SOLD);
        bet.setActualPayout(value.toBigDecimal());
        bet.setResolvedAt(now);

        log.info("Position sold: betId={}, userId={}, stake={}, returned={}, newBalance={}",
                betId, userId, stake, value, newBalance);
        return new SaleResult(bet, value.toBigDecimal(), newBalance);
    }

    public Bet getBet(String userId, String betId) {
        return betRepository.findById(betId)
                .filter(b -> b.isOwnedBy(userId))
                .orElseThrow(() -> new NotFoundException("bet", betId));
    }

    /**
     * A user's bets, newest first.
     *
     * @param status optional filter
     * @param marketId optional filter
     * @param limit page size; null for 50, clamped to 200
     * @param offset bets to skip; null for 0
     */
    public List<Bet> listBets(String userId, BetStatus status, String marketId, Integer limit, Long offset) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId is required");
        }
        int pageSize = limit == null ? LedgerService.DEFAULT_PAGE_SIZE : limit;
        long skip = offset == null ? 0L : offset;
        if (pageSize < 1 || skip < 0) {
            throw new ValidationException("limit must be at least 1 and offset must not be negative");
        }
        return betRepository.findPage(userId, status, marketId, Math.min(pageSize, LedgerService.MAX_PAGE_SIZE), skip);
    }

    private MarketState requireOpenMarket(String marketId, Instant now) {
        MarketState market = marketDirectory.resolve(marketId)
                .orElseThrow(() -> new MarketNotOpenException(marketId, "unknown market"));
        if (!market.isOpenAt(now)) {
            String reason = market.getStatus() == MarketStatus.OPEN ? "expired" : "status " + market.getStatus();
            log.warn("Market not open: marketId={}, reason={}", market.getId(), reason);
            throw new MarketNotOpenException(market.getId(), reason);
        }
        return market;
    }

    private void clearSkip(String userId, String marketId) {
        try {
            marketSkipService.removeSkip(userId, marketId);
        } catch (DataAccessException e) {
            log.warn("Failed to clear skip after bet: userId={}, marketId={}, error={}", userId, marketId, e.getMessage());
        }
    }

    /**
     * Bets placed with an idempotency key get an id derived from (userId, key), so two concurrent
     * requests with the same key collide on the same bet and ledger nonce.
     */
    static String betIdFor(String userId, String idempotencyKey) {
        if (idempotencyKey == null) {
            return UUID.randomUUID().toString();
        }
        return UUID.nameUUIDFromBytes((userId + ":" + idempotencyKey).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
