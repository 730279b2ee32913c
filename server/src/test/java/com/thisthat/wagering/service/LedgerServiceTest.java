package com.thisthat.wagering.service;

import com.thisthat.wagering.config.WageringProperties;
import com.thisthat.wagering.entity.CreditHold;
import com.thisthat.wagering.entity.CreditTransaction;
import com.thisthat.wagering.entity.HoldStatus;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerServiceTest {

    private static final String USER = "u1";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    UserAccountRepository userAccountRepository;
    @Mock
    CreditTransactionRepository creditTransactionRepository;
    @Mock
    CreditHoldRepository creditHoldRepository;

    private LedgerService ledgerService;

    @BeforeEach
    void setUp() {
        ledgerService = new LedgerService(userAccountRepository, creditTransactionRepository, creditHoldRepository,
                new WageringProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static UserAccount account(String balance, String held, long sequence) {
        BigDecimal total = new BigDecimal(balance);
        BigDecimal reserved = new BigDecimal(held);
        return UserAccount.builder()
                .id(USER)
                .creditBalance(total)
                .availableCredits(total.subtract(reserved))
                .heldCredits(reserved)
                .ledgerSequence(sequence)
                .build();
    }

    private void insertReturnsArgument() {
        when(creditTransactionRepository.insert(any(CreditTransaction.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("credit appends an entry carrying the post-update balance and sequence")
    void creditAppendsEntry() {
        when(userAccountRepository.applyCredit(USER, new BigDecimal("95.00"), NOW))
                .thenReturn(Optional.of(account("1045.00", "0", 3)));
        insertReturnsArgument();

        CreditTransaction tx = ledgerService.credit(USER, new BigDecimal("95"), TransactionType.PAYOUT, "b1");

        assertThat(tx.getAmount()).isEqualByComparingTo("95.00");
        assertThat(tx.getBalanceAfter()).isEqualByComparingTo("1045.00");
        assertThat(tx.getSequence()).isEqualTo(3);
        assertThat(tx.getNonce()).isEqualTo("payout:b1");
        assertThat(tx.getTransactionType()).isEqualTo(TransactionType.PAYOUT);
        assertThat(tx.getReferenceId()).isEqualTo("b1");
        assertThat(tx.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("debit records a negative amount")
    void debitRecordsNegativeAmount() {
        when(userAccountRepository.applyDebit(USER, new BigDecimal("50.00"), NOW))
                .thenReturn(Optional.of(account("950.00", "0", 2)));
        insertReturnsArgument();

        CreditTransaction tx = ledgerService.debit(USER, new BigDecimal("50"), TransactionType.BET, "b1");

        assertThat(tx.getAmount()).isEqualByComparingTo("-50.00");
        assertThat(tx.getBalanceAfter()).isEqualByComparingTo("950.00");
        assertThat(tx.getNonce()).isEqualTo("bet:b1");
    }

    @Test
    @DisplayName("debit beyond available credits fails without writing a ledger row")
    void debitInsufficientFunds() {
        when(userAccountRepository.applyDebit(eq(USER), any(), eq(NOW))).thenReturn(Optional.empty());
        when(userAccountRepository.existsById(USER)).thenReturn(true);

        assertThatThrownBy(() -> ledgerService.debit(USER, new BigDecimal("10"), TransactionType.BET, "b1"))
                .isInstanceOf(InsufficientFundsException.class)
                .satisfies(e -> assertThat(((InsufficientFundsException) e).getErrorCode())
                        .isEqualTo(InsufficientFundsException.CODE));

        verify(creditTransactionRepository, never()).insert(any(CreditTransaction.class));
    }

    @Test
    void debitUnknownUser() {
        when(userAccountRepository.applyDebit(eq(USER), any(), eq(NOW))).thenReturn(Optional.empty());
        when(userAccountRepository.existsById(USER)).thenReturn(false);

        assertThatThrownBy(() -> ledgerService.debit(USER, new BigDecimal("10"), TransactionType.BET, "b1"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void creditUnknownUser() {
        when(userAccountRepository.applyCredit(eq(USER), any(), eq(NOW))).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledgerService.credit(USER, new BigDecimal("10"), TransactionType.REFUND, "b1"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("an already recorded nonce is rejected before the balance moves, carrying the prior entry")
    void recordedNonceRejected() {
        CreditTransaction prior = CreditTransaction.builder()
                .id("t7")
                .userId(USER)
                .amount(new BigDecimal("95.00"))
                .transactionType(TransactionType.PAYOUT)
                .referenceId("b1")
                .balanceAfter(new BigDecimal("1045.00"))
                .sequence(7)
                .nonce("payout:b1")
                .build();
        when(creditTransactionRepository.findByNonce("payout:b1")).thenReturn(Optional.of(prior));

        assertThatThrownBy(() -> ledgerService.credit(USER, new BigDecimal("95"), TransactionType.PAYOUT, "b1"))
                .isInstanceOf(DuplicateRequestException.class)
                .satisfies(e -> assertThat(((DuplicateRequestException) e).getRecorded()).isSameAs(prior));

        verify(userAccountRepository, never()).applyCredit(anyString(), any(), any());
    }

    @Test
    @DisplayName("a nonce collision on insert surfaces as a duplicate request")
    void nonceCollisionOnInsert() {
        when(userAccountRepository.applyCredit(eq(USER), any(), eq(NOW)))
                .thenReturn(Optional.of(account("100.00", "0", 1)));
        when(creditTransactionRepository.insert(any(CreditTransaction.class)))
                .thenThrow(new DuplicateKeyException("E11000 duplicate key"));

        assertThatThrownBy(() -> ledgerService.credit(USER, new BigDecimal("100"), TransactionType.GRANT, "g1"))
                .isInstanceOf(DuplicateRequestException.class)
                .hasCauseInstanceOf(DuplicateKeyException.class);
    }

    @Test
    @DisplayName("non-positive amounts are rejected")
    void rejectsNonPositiveAmounts() {
        assertThatThrownBy(() -> ledgerService.credit(USER, BigDecimal.ZERO, TransactionType.GRANT, "g1"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledgerService.debit(USER, new BigDecimal("-5"), TransactionType.BET, "b1"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledgerService.debit(USER, new BigDecimal("0.001"), TransactionType.BET, "b1"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledgerService.debit(" ", BigDecimal.TEN, TransactionType.BET, "b1"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("transient store errors are translated, not swallowed")
    void transientStoreError() {
        when(userAccountRepository.applyDebit(eq(USER), any(), eq(NOW)))
                .thenThrow(new QueryTimeoutException("timed out"));

        assertThatThrownBy(() -> ledgerService.debit(USER, BigDecimal.TEN, TransactionType.BET, "b1"))
                .isInstanceOf(TransientStoreException.class);
    }

    @Test
    void getBalance() {
        when(userAccountRepository.findById(USER)).thenReturn(Optional.of(account("500.00", "120.00", 4)));

        BalanceView view = ledgerService.getBalance(USER);

        assertThat(view.getBalance()).isEqualByComparingTo("500");
        assertThat(view.getAvailable()).isEqualByComparingTo("380");
        assertThat(view.getHeld()).isEqualByComparingTo("120");
    }

    @Test
    void getBalanceUnknownUser() {
        when(userAccountRepository.findById(USER)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledgerService.getBalance(USER)).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("listTransactions defaults to 50 and clamps to 200")
    void listTransactionsPaging() {
        when(creditTransactionRepository.findPage(USER, null, 50, 0L)).thenReturn(List.of());
        when(creditTransactionRepository.findPage(USER, TransactionType.BET, 200, 20L)).thenReturn(List.of());
        when(creditTransactionRepository.countFor(USER, null)).thenReturn(7L);
        when(creditTransactionRepository.countFor(USER, TransactionType.BET)).thenReturn(3L);

        TransactionPage defaults = ledgerService.listTransactions(USER, null, null, null);
        TransactionPage clamped = ledgerService.listTransactions(USER, TransactionType.BET, 500, 20L);

        assertThat(defaults.getLimit()).isEqualTo(50);
        assertThat(defaults.getTotal()).isEqualTo(7);
        assertThat(clamped.getLimit()).isEqualTo(200);
        assertThat(clamped.getOffset()).isEqualTo(20);
        assertThat(clamped.getTotal()).isEqualTo(3);
    }

    @Test
    void listTransactionsRejectsBadPaging() {
        assertThatThrownBy(() -> ledgerService.listTransactions(USER, null, 0, 0L))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledgerService.listTransactions(USER, null, 10, -1L))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("opening a new account grants the starting credits once")
    void openAccountGrantsStartingCredits() {
        when(userAccountRepository.createIfAbsent(USER, NOW)).thenReturn(true);
        when(userAccountRepository.applyCredit(USER, new BigDecimal("1000.00"), NOW))
                .thenReturn(Optional.of(account("1000.00", "0", 1)));
        insertReturnsArgument();
        when(userAccountRepository.findById(USER)).thenReturn(Optional.of(account("1000.00", "0", 1)));

        UserAccount opened = ledgerService.openAccount(USER);

        assertThat(opened.getCreditBalance()).isEqualByComparingTo("1000");
        ArgumentCaptor<CreditTransaction> captor = ArgumentCaptor.forClass(CreditTransaction.class);
        verify(creditTransactionRepository).insert(captor.capture());
        assertThat(captor.getValue().getTransactionType()).isEqualTo(TransactionType.GRANT);
        assertThat(captor.getValue().getNonce()).isEqualTo("grant:signup:u1");
    }

    @Test
    void openExistingAccountGrantsNothing() {
        when(userAccountRepository.createIfAbsent(USER, NOW)).thenReturn(false);
        when(userAccountRepository.findById(USER)).thenReturn(Optional.of(account("10.00", "0", 5)));

        ledgerService.openAccount(USER);

        verify(userAccountRepository, never()).applyCredit(anyString(), any(), any());
    }

    @Test
    @DisplayName("a hold larger than available credits is refused")
    void placeHoldInsufficient() {
        when(userAccountRepository.reserve(eq(USER), any(), eq(NOW))).thenReturn(Optional.empty());
        when(userAccountRepository.existsById(USER)).thenReturn(true);

        assertThatThrownBy(() -> ledgerService.placeHold(USER, new BigDecimal("500"), "withdrawal", "w1"))
                .isInstanceOf(InsufficientFundsException.class);
        verify(creditHoldRepository, never()).insert(any(CreditHold.class));
    }

    @Test
    void placeHold() {
        when(userAccountRepository.reserve(USER, new BigDecimal("40.00"), NOW))
                .thenReturn(Optional.of(account("100.00", "40.00", 1)));
        when(creditHoldRepository.insert(any(CreditHold.class))).thenAnswer(inv -> inv.getArgument(0));

        CreditHold hold = ledgerService.placeHold(USER, new BigDecimal("40"), "withdrawal", "w1");

        assertThat(hold.getStatus()).isEqualTo(HoldStatus.ACTIVE);
        assertThat(hold.getAmount()).isEqualByComparingTo("40");
        assertThat(hold.getId()).isNotBlank();
    }

    @Test
    @DisplayName("capturing a hold spends the held credits and records HOLD_CAPTURE")
    void captureHold() {
        CreditHold hold = CreditHold.builder().id("h1").userId(USER).amount(new BigDecimal("40.00")).build();
        when(creditHoldRepository.findById("h1")).thenReturn(Optional.of(hold));
        when(creditHoldRepository.closeIfActive("h1", HoldStatus.CAPTURED, NOW)).thenReturn(1L);
        when(userAccountRepository.captureReserved(USER, new BigDecimal("40.00"), NOW))
                .thenReturn(Optional.of(account("60.00", "0", 2)));
        insertReturnsArgument();

        CreditTransaction tx = ledgerService.captureHold("h1");

        assertThat(tx.getAmount()).isEqualByComparingTo("-40");
        assertThat(tx.getBalanceAfter()).isEqualByComparingTo("60");
        assertThat(tx.getTransactionType()).isEqualTo(TransactionType.HOLD_CAPTURE);
        assertThat(tx.getNonce()).isEqualTo("hold_capture:h1");
    }

    @Test
    void releaseClosedHoldRejected() {
        CreditHold hold = CreditHold.builder().id("h1").userId(USER).amount(new BigDecimal("40.00")).build();
        when(creditHoldRepository.findById("h1")).thenReturn(Optional.of(hold));
        when(creditHoldRepository.closeIfActive("h1", HoldStatus.RELEASED, NOW)).thenReturn(0L);

        assertThatThrownBy(() -> ledgerService.releaseHold("h1")).isInstanceOf(ValidationException.class);
        verify(userAccountRepository, never()).unreserve(anyString(), any(), any());
    }

    @Test
    void releaseHold() {
        CreditHold hold = CreditHold.builder().id("h1").userId(USER).amount(new BigDecimal("40.00")).build();
        when(creditHoldRepository.findById("h1")).thenReturn(Optional.of(hold));
        when(creditHoldRepository.closeIfActive("h1", HoldStatus.RELEASED, NOW)).thenReturn(1L);
        when(userAccountRepository.unreserve(USER, new BigDecimal("40.00"), NOW))
                .thenReturn(Optional.of(account("100.00", "0", 1)));

        CreditHold released = ledgerService.releaseHold("h1");

        assertThat(released.getStatus()).isEqualTo(HoldStatus.RELEASED);
        assertThat(released.getClosedAt()).isEqualTo(NOW);
    }

    private UserAccount claimant(Instant lastClaim, int streak) {
        UserAccount account = account("1000.00", "0", 4);
        account.setLastDailyRewardAt(lastClaim);
        account.setConsecutiveDays(streak);
        when(userAccountRepository.findById(USER)).thenReturn(Optional.of(account));
        return account;
    }

    @Test
    @DisplayName("the first daily claim pays the first-claim bonus and starts the streak")
    void firstDailyClaim() {
        claimant(null, 0);
        when(userAccountRepository.applyCredit(USER, new BigDecimal("500.00"), NOW))
                .thenReturn(Optional.of(account("1500.00", "0", 5)));
        insertReturnsArgument();

        DailyClaim claim = ledgerService.claimDailyCredits(USER);

        assertThat(claim.isNewlyClaimed()).isTrue();
        assertThat(claim.getCreditsAwarded()).isEqualByComparingTo("500");
        assertThat(claim.getConsecutiveDays()).isEqualTo(1);
        assertThat(claim.getBalanceAfter()).isEqualByComparingTo("1500.00");
        assertThat(claim.getNextAvailableAt()).isEqualTo(Instant.parse("2026-03-02T00:00:00Z"));

        ArgumentCaptor<CreditTransaction> entry = ArgumentCaptor.forClass(CreditTransaction.class);
        verify(creditTransactionRepository).insert(entry.capture());
        assertThat(entry.getValue().getTransactionType()).isEqualTo(TransactionType.DAILY_REWARD);
        assertThat(entry.getValue().getNonce()).isEqualTo("daily_reward:u1:2026-03-01");
        verify(userAccountRepository).recordDailyClaim(USER, 1, NOW);
    }

    @Test
    @DisplayName("a claim the day after the last one extends the streak and its bonus")
    void consecutiveDailyClaim() {
        claimant(Instant.parse("2026-02-28T23:30:00Z"), 3);
        when(userAccountRepository.applyCredit(USER, new BigDecimal("150.00"), NOW))
                .thenReturn(Optional.of(account("1150.00", "0", 5)));
        insertReturnsArgument();

        DailyClaim claim = ledgerService.claimDailyCredits(USER);

        assertThat(claim.getConsecutiveDays()).isEqualTo(4);
        assertThat(claim.getCreditsAwarded()).isEqualByComparingTo("150");
        verify(userAccountRepository).recordDailyClaim(USER, 4, NOW);
    }

    @Test
    @DisplayName("a missed day restarts the streak at the base amount")
    void brokenStreak() {
        claimant(Instant.parse("2026-02-26T10:00:00Z"), 7);
        when(userAccountRepository.applyCredit(USER, new BigDecimal("100.00"), NOW))
                .thenReturn(Optional.of(account("1100.00", "0", 5)));
        insertReturnsArgument();

        DailyClaim claim = ledgerService.claimDailyCredits(USER);

        assertThat(claim.getConsecutiveDays()).isEqualTo(1);
        assertThat(claim.getCreditsAwarded()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("a second claim on the same UTC day returns the first one and moves nothing")
    void secondClaimSameDay() {
        claimant(Instant.parse("2026-03-01T01:00:00Z"), 2);
        CreditTransaction earlier = CreditTransaction.builder()
                .id("t4")
                .userId(USER)
                .amount(new BigDecimal("100.00"))
                .transactionType(TransactionType.DAILY_REWARD)
                .balanceAfter(new BigDecimal("1000.00"))
                .sequence(4)
                .nonce("daily_reward:u1:2026-03-01")
                .build();
        when(creditTransactionRepository.findByNonce("daily_reward:u1:2026-03-01")).thenReturn(Optional.of(earlier));

        DailyClaim claim = ledgerService.claimDailyCredits(USER);

        assertThat(claim.isNewlyClaimed()).isFalse();
        assertThat(claim.getCreditsAwarded()).isEqualByComparingTo("100");
        assertThat(claim.getConsecutiveDays()).isEqualTo(2);
        verify(userAccountRepository, never()).applyCredit(anyString(), any(), any());
        verify(userAccountRepository, never()).recordDailyClaim(anyString(), anyInt(), any());
    }

    @Test
    void dailyClaimUnknownUser() {
        when(userAccountRepository.findById(USER)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledgerService.claimDailyCredits(USER)).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("daily amounts: 100 for streak days 1 to 3, then +50 every two days")
    void dailySchedule() {
        WageringProperties.Daily daily = new WageringProperties.Daily();

        assertThat(LedgerService.dailyCreditsFor(daily, 1, true)).isEqualByComparingTo("500");
        assertThat(LedgerService.dailyCreditsFor(daily, 1, false)).isEqualByComparingTo("100");
        assertThat(LedgerService.dailyCreditsFor(daily, 3, false)).isEqualByComparingTo("100");
        assertThat(LedgerService.dailyCreditsFor(daily, 4, false)).isEqualByComparingTo("150");
        assertThat(LedgerService.dailyCreditsFor(daily, 5, false)).isEqualByComparingTo("150");
        assertThat(LedgerService.dailyCreditsFor(daily, 6, false)).isEqualByComparingTo("200");
        assertThat(LedgerService.dailyCreditsFor(daily, 9, false)).isEqualByComparingTo("250");
    }
}
