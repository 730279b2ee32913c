package com.thisthat.wagering.service;

import com.thisthat.wagering.config.WageringProperties;
import com.thisthat.wagering.entity.CreditHold;
import com.thisthat.wagering.entity.CreditTransaction;
import com.thisthat.wagering.entity.HoldStatus;
import com.thisthat.wagering.entity.Money;
import com.thisthat.wagering.entity.TransactionType;
import com.thisthat.wagering.entity.UserAccount;
import com.thisthat.wagering.exception.DuplicateRequestException;
import com.thisthat.wagering.exception.InsufficientFundsException;
import com.thisthat.wagering.exception.NotFoundException;
import com.thisthat.wagering.exception.TransientStoreException;
import com.thisthat.wagering.exception.ValidationException;
import com.thisthat.wagering.repositories.CreditHoldRepository;
import com.thisthat.wagering.repositories.CreditTransactionRepository;
import com.thisthat.wagering.repositories.UserAccountRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Credit ledger: the only component that changes a user's balance.
 *
 * Every balance change is one conditional update on the user document plus one appended
 * {@link CreditTransaction}, committed together in a MongoDB transaction. The update increments
 * ledgerSequence, so the appended row carries the post-update balance and a gap-free sequence.
 * Two concurrent changes to one user conflict on the document; the loser aborts and its caller
 * retries (see {@link StoreRetries}).
 *
 * Methods join the caller's transaction when there is one, so a bet insert and its debit
 * commit or roll back together.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService {

    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 200;

    private final UserAccountRepository userAccountRepository;
    private final CreditTransactionRepository creditTransactionRepository;
    private final CreditHoldRepository creditHoldRepository;
    private final WageringProperties properties;
    private final Clock clock;

    /**
     * Create the account if it does not exist yet and grant the starting credits once.
     */
    @Transactional
    public UserAccount openAccount(String userId) {
        requireUserId(userId);
        boolean created = store("open-account", () -> userAccountRepository.createIfAbsent(userId, clock.instant()));
        if (created) {
            BigDecimal grant = properties.getAccount().getStartingCredits();
            if (grant != null && grant.signum() > 0) {
                credit(userId, grant, TransactionType.GRANT, "signup:" + userId);
            }
            log.info("Account opened: userId={}, startingCredits={}", userId, grant);
        }
        return userAccountRepository.findById(userId).orElseThrow(() -> new NotFoundException("user", userId));
    }

    /**
     * Add credits to a user's balance.
     *
     * @throws NotFoundException unknown user
     * @throws DuplicateRequestException this (type, referenceId) was already credited; the
     *         exception carries the recorded entry, which is the prior result of the request
     */
    @Transactional
    public CreditTransaction credit(String userId, BigDecimal amount, TransactionType type, String referenceId) {
        requireUserId(userId);
        Money money = requirePositive(amount);
        String nonce = nonceFor(type, referenceId);
        rejectIfRecorded(nonce);

        Instant now = clock.instant();
        UserAccount account = store("credit", () -> userAccountRepository.applyCredit(userId, money.toBigDecimal(), now))
                .orElseThrow(() -> new NotFoundException("user", userId));

        CreditTransaction tx = append(account, money.toBigDecimal(), type, referenceId, nonce, now);
        log.info("Credited: userId={}, amount={}, type={}, referenceId={}, balanceAfter={}",
                userId, money, type, referenceId, tx.getBalanceAfter());
        return tx;
    }

    /**
     * Remove credits from a user's balance. Never partially applied.
     *
     * @throws InsufficientFundsException amount exceeds available credits
     * @throws NotFoundException unknown user
     * @throws DuplicateRequestException this (type, referenceId) was already debited; carries the
     *         recorded entry
     */
    @Transactional
    public CreditTransaction debit(String userId, BigDecimal amount, TransactionType type, String referenceId) {
        requireUserId(userId);
        Money money = requirePositive(amount);
        String nonce = nonceFor(type, referenceId);
        rejectIfRecorded(nonce);

        Instant now = clock.instant();
        Optional<UserAccount> updated = store("debit",
                () -> userAccountRepository.applyDebit(userId, money.toBigDecimal(), now));
        if (updated.isEmpty()) {
            throw rejection(userId, money);
        }

        CreditTransaction tx = append(updated.get(), money.negate().toBigDecimal(), type, referenceId, nonce, now);
        log.info("Debited: userId={}, amount={}, type={}, referenceId={}, balanceAfter={}",
                userId, money, type, referenceId, tx.getBalanceAfter());
        return tx;
    }

    /**
     * Claim today's credits (days are UTC). The streak grows when the previous claim was
     * yesterday and restarts at 1 otherwise. At most one claim per user per day: the ledger
     * nonce {@code daily_reward:{userId}:{date}} is unique, and a repeat returns today's claim.
     *
     * @throws NotFoundException unknown user
     */
    @Transactional
    public DailyClaim claimDailyCredits(String userId) {
        requireUserId(userId);
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        Instant nextAvailableAt = today.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        UserAccount account = store("find-account", () -> userAccountRepository.findById(userId))
                .orElseThrow(() -> new NotFoundException("user", userId));

        String referenceId = userId + ":" + today;
        String nonce = nonceFor(TransactionType.DAILY_REWARD, referenceId);
        Optional<CreditTransaction> claimed = store("nonce-check", () -> creditTransactionRepository.findByNonce(nonce));
        if (claimed.isPresent()) {
            log.info("Daily credits already claimed: userId={}, date={}", userId, today);
            return new DailyClaim(userId, claimed.get().getAmount(), account.getConsecutiveDays(),
                    claimed.get().getBalanceAfter(), nextAvailableAt, false);
        }

        Instant lastClaim = account.getLastDailyRewardAt();
        int streak = 1;
        if (lastClaim != null) {
            long daysSince = ChronoUnit.DAYS.between(LocalDate.ofInstant(lastClaim, ZoneOffset.UTC), today);
            if (daysSince == 1) {
                streak = account.getConsecutiveDays() + 1;
            } else if (daysSince <= 0) {
                streak = Math.max(1, account.getConsecutiveDays());
            }
        }
        BigDecimal amount = dailyCreditsFor(properties.getDaily(), streak, lastClaim == null);

        CreditTransaction tx = credit(userId, amount, TransactionType.DAILY_REWARD, referenceId);
        int finalStreak = streak;
        store("record-daily-claim", () -> {
            userAccountRepository.recordDailyClaim(userId, finalStreak, now);
            return null;
        });
        log.info("Daily credits claimed: userId={}, amount={}, consecutiveDays={}, balanceAfter={}",
                userId, tx.getAmount(), streak, tx.getBalanceAfter());
        return new DailyClaim(userId, tx.getAmount(), streak, tx.getBalanceAfter(), nextAvailableAt, true);
    }

    public BalanceView getBalance(String userId) {
        requireUserId(userId);
        UserAccount account = store("get-balance", () -> userAccountRepository.findById(userId))
                .orElseThrow(() -> new NotFoundException("user", userId));
        return new BalanceView(userId, account.getCreditBalance(), account.getAvailableCredits(),
                account.getHeldCredits());
    }

    /**
     * Page through a user's ledger, newest first.
     *
     * @param type optional filter
     * @param limit page size; null for 50, clamped to 200
     * @param offset entries to skip; null for 0
     */
    public TransactionPage listTransactions(String userId, TransactionType type, Integer limit, Long offset) {
        requireUserId(userId);
        int pageSize = limit == null ? DEFAULT_PAGE_SIZE : limit;
        long skip = offset == null ? 0L : offset;
        if (pageSize < 1) {
            throw new ValidationException("limit must be at least 1");
        }
        if (skip < 0) {
            throw new ValidationException("offset must not be negative");
        }
        pageSize = Math.min(pageSize, MAX_PAGE_SIZE);

        int finalPageSize = pageSize;
        return store("list-transactions", () -> new TransactionPage(
                creditTransactionRepository.findPage(userId, type, finalPageSize, skip),
                creditTransactionRepository.countFor(userId, type),
                finalPageSize,
                skip));
    }

    /**
     * Reserve credits: they stay in the balance but can no longer be spent until released or captured.
     */
    @Transactional
    public CreditHold placeHold(String userId, BigDecimal amount, String reason, String referenceId) {
        requireUserId(userId);
        Money money = requirePositive(amount);
        Instant now = clock.instant();

        if (store("reserve", () -> userAccountRepository.reserve(userId, money.toBigDecimal(), now)).isEmpty()) {
            throw rejection(userId, money);
        }

        CreditHold hold = store("insert-hold", () -> creditHoldRepository.insert(CreditHold.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .amount(money.toBigDecimal())
                .reason(reason)
                .referenceId(referenceId)
                .status(HoldStatus.ACTIVE)
                .createdAt(now)
                .build()));
        log.info("Hold placed: holdId={}, userId={}, amount={}, reason={}", hold.getId(), userId, money, reason);
        return hold;
    }

    /**
     * Return held credits to available.
     */
    @Transactional
    public CreditHold releaseHold(String holdId) {
        CreditHold hold = closeHold(holdId, HoldStatus.RELEASED);
        store("unreserve", () -> userAccountRepository.unreserve(hold.getUserId(), hold.getAmount(), hold.getClosedAt()))
                .orElseThrow(() -> new IllegalStateException("Held credits missing for hold " + holdId));
        log.info("Hold released: holdId={}, userId={}, amount={}", holdId, hold.getUserId(), hold.getAmount());
        return hold;
    }

    /**
     * Spend held credits, recording a HOLD_CAPTURE entry.
     */
    @Transactional
    public CreditTransaction captureHold(String holdId) {
        CreditHold hold = closeHold(holdId, HoldStatus.CAPTURED);
        String nonce = nonceFor(TransactionType.HOLD_CAPTURE, holdId);
        UserAccount account = store("capture",
                () -> userAccountRepository.captureReserved(hold.getUserId(), hold.getAmount(), hold.getClosedAt()))
                .orElseThrow(() -> new IllegalStateException("Held credits missing for hold " + holdId));

        CreditTransaction tx = append(account, hold.getAmount().negate(), TransactionType.HOLD_CAPTURE, holdId,
                nonce, hold.getClosedAt());
        log.info("Hold captured: holdId={}, userId={}, amount={}, balanceAfter={}",
                holdId, hold.getUserId(), hold.getAmount(), tx.getBalanceAfter());
        return tx;
    }

    private CreditHold closeHold(String holdId, HoldStatus target) {
        CreditHold hold = store("find-hold", () -> creditHoldRepository.findById(holdId))
                .orElseThrow(() -> new NotFoundException("hold", holdId));
        Instant now = clock.instant();
        if (store("close-hold", () -> creditHoldRepository.closeIfActive(holdId, target, now)) == 0) {
            throw new ValidationException("hold " + holdId + " is not active");
        }
        hold.setStatus(target);
        hold.setClosedAt(now);
        return hold;
    }

    private CreditTransaction append(UserAccount account, BigDecimal signedAmount, TransactionType type,
                                     String referenceId, String nonce, Instant now) {
        CreditTransaction tx = CreditTransaction.builder()
                .id(UUID.randomUUID().toString())
                .userId(account.getId())
                .amount(signedAmount)
                .transactionType(type)
                .referenceId(referenceId)
                .balanceAfter(account.getCreditBalance())
                .sequence(account.getLedgerSequence())
                .nonce(nonce)
                .createdAt(now)
                .build();
        try {
            return store("append", () -> creditTransactionRepository.insert(tx));
        } catch (DuplicateKeyException e) {
            log.warn("Duplicate ledger entry rejected: userId={}, nonce={}", account.getId(), nonce);
            throw new DuplicateRequestException(nonce, e);
        }
    }

    private void rejectIfRecorded(String nonce) {
        if (nonce == null) {
            return;
        }
        Optional<CreditTransaction> recorded = store("nonce-check", () -> creditTransactionRepository.findByNonce(nonce));
        if (recorded.isPresent()) {
            log.info("Ledger entry already recorded: nonce={}, transactionId={}", nonce, recorded.get().getId());
            throw new DuplicateRequestException(nonce, recorded.get(), null);
        }
    }

    private RuntimeException rejection(String userId, Money money) {
        if (!store("exists", () -> userAccountRepository.existsById(userId))) {
            return new NotFoundException("user", userId);
        }
        log.warn("Insufficient credits: userId={}, requested={}", userId, money);
        return new InsufficientFundsException(userId, money.toBigDecimal());
    }

    /**
     * Ledger nonce for an effect: {type}:{referenceId}. Null when there is no reference.
     */
    static String nonceFor(TransactionType type, String referenceId) {
        return referenceId == null ? null : type.name().toLowerCase(Locale.ROOT) + ":" + referenceId;
    }

    static BigDecimal dailyCreditsFor(WageringProperties.Daily daily, int streak, boolean firstClaim) {
        if (firstClaim) {
            return daily.getFirstClaim();
        }
        int day = Math.max(1, streak);
        if (day <= 3) {
            return daily.getBase();
        }
        int steps = (day - 2) / daily.getStreakBonusInterval();
        return daily.getBase().add(daily.getStreakBonus().multiply(BigDecimal.valueOf(steps)));
    }

    private static Money requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("amount must be positive");
        }
        Money money = Money.of(amount);
        if (!money.isPositive()) {
            throw new ValidationException("amount must be at least 0.01");
        }
        return money;
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId is required");
        }
    }

    private static <T> T store(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DuplicateKeyException e) {
            throw e;
        } catch (DataAccessException e) {
            if (StoreRetries.isTransient(e)) {
                throw new TransientStoreException(operation, e);
            }
            throw e;
        }
    }
}
