package com.thisthat.wagering.service;

import com.thisthat.wagering.entity.CreditTransaction;
import com.thisthat.wagering.entity.UserAccount;
import com.thisthat.wagering.exception.NotFoundException;
import com.thisthat.wagering.repositories.CreditTransactionRepository;
import com.thisthat.wagering.repositories.UserAccountRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Replays the ledger against cached balances.
 * The ledger (credit_transactions) is the SOURCE OF TRUTH; creditBalance is derived from it.
 *
 * Divergence is logged at ERROR and returned; cached balances are never rewritten here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerAuditService {

    private static final int USER_PAGE_SIZE = 500;

    private final UserAccountRepository userAccountRepository;
    private final CreditTransactionRepository creditTransactionRepository;

    /**
     * Replay one user's ledger by sequence, from zero.
     */
    public LedgerAudit audit(String userId) {
        UserAccount account = userAccountRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("user", userId));
        return audit(account);
    }

    /**
     * Audit every account.
     *
     * @return accounts whose ledger does not match their balance
     */
    public List<LedgerAudit> auditAll() {
        log.info("Starting ledger audit...");
        List<LedgerAudit> divergent = new ArrayList<>();
        int checked = 0;

        Page<UserAccount> page = userAccountRepository.findAll(PageRequest.of(0, USER_PAGE_SIZE, Sort.by("id")));
        while (true) {
            for (UserAccount account : page.getContent()) {
                LedgerAudit audit = audit(account);
                if (!audit.isConsistent()) {
                    log.error("Ledger divergence: userId={}, stored={}, replayed={}, brokenEntries={}, holdsConsistent={}",
                            audit.getUserId(), audit.getStoredBalance(), audit.getReplayedBalance(),
                            audit.getBrokenEntries(), audit.isHoldsConsistent());
                    divergent.add(audit);
                }
                checked++;
            }
            if (!page.hasNext()) {
                break;
            }
            page = userAccountRepository.findAll(page.nextPageable());
        }

        log.info("Ledger audit complete: {} accounts checked, {} divergent", checked, divergent.size());
        return divergent;
    }

    private LedgerAudit audit(UserAccount account) {
        BigDecimal running = BigDecimal.ZERO;
        long expectedSequence = 1;
        long entries = 0;
        List<String> broken = new ArrayList<>();

        try (Stream<CreditTransaction> ledger =
                     creditTransactionRepository.streamByUserIdOrderBySequenceAsc(account.getId())) {
            for (CreditTransaction tx : (Iterable<CreditTransaction>) ledger::iterator) {
                running = running.add(tx.getAmount());
                if (tx.getSequence() != expectedSequence
                        || tx.getBalanceAfter() == null
                        || tx.getBalanceAfter().compareTo(running) != 0) {
                    broken.add(tx.getId());
                }
                expectedSequence = tx.getSequence() + 1;
                entries++;
            }
        }

        boolean holdsConsistent = account.getAvailableCredits().add(account.getHeldCredits())
                .compareTo(account.getCreditBalance()) == 0
                && account.getAvailableCredits().signum() >= 0;

        return new LedgerAudit(account.getId(), account.getCreditBalance(), running, entries, broken, holdsConsistent);
    }
}
