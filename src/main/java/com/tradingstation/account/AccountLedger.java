package com.tradingstation.account;

import com.tradingstation.domain.model.Account;
import com.tradingstation.exception.ResourceNotFoundException;
import com.tradingstation.repository.AccountRepository;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns account cash. Reservations debit cash before a buy executes; releases and P&L
 * postings credit it back.
 *
 * <p>An insufficient-funds reservation is an ordinary outcome: {@link #reserveFunds}
 * returns false and leaves the balance untouched. Unknown accounts fail with
 * {@link ResourceNotFoundException}.
 */
@Service
public class AccountLedger {

    private static final Logger log = LoggerFactory.getLogger(AccountLedger.class);

    private final AccountRepository accountRepository;
    private final AccountLockManager accountLockManager;

    public AccountLedger(AccountRepository accountRepository, AccountLockManager accountLockManager) {
        this.accountRepository = accountRepository;
        this.accountLockManager = accountLockManager;
    }

    /** Creates an active account whose cash equals its initial capital. */
    public Account openAccount(String name, BigDecimal initialCapital) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new IllegalArgumentException("Initial capital must be positive: " + initialCapital);
        }
        Account account = accountRepository.save(Account.builder()
                .name(name)
                .initialCapital(initialCapital)
                .currentCash(initialCapital)
                .build());
        log.info("Account opened: id={}, name={}, capital={}", account.getId(), name, initialCapital);
        return account;
    }

    public Account getAccount(Long accountId) {
        return accountRepository
                .findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
    }

    public BigDecimal getAvailableBalance(Long accountId) {
        return getAccount(accountId).getAvailableCash();
    }

    /**
     * Debits {@code amount} if the account has at least that much cash.
     *
     * @return true if reserved, false (balance unchanged) if funds are insufficient
     */
    public boolean reserveFunds(Long accountId, BigDecimal amount) {
        requireNonNegative(amount);
        return accountLockManager.withLock(accountId, () -> {
            Account account = getAccount(accountId);
            if (amount.compareTo(account.getAvailableCash()) > 0) {
                log.warn(
                        "Insufficient funds on account {}: requested={}, available={}",
                        accountId,
                        amount,
                        account.getAvailableCash());
                return false;
            }
            accountRepository.save(account.toBuilder()
                    .currentCash(account.getCurrentCash().subtract(amount))
                    .build());
            log.debug("Reserved {} on account {}", amount, accountId);
            return true;
        });
    }

    /** Credits back a previous reservation. */
    public void releaseFunds(Long accountId, BigDecimal amount) {
        requireNonNegative(amount);
        accountLockManager.runWithLock(accountId, () -> {
            Account account = getAccount(accountId);
            accountRepository.save(account.toBuilder()
                    .currentCash(account.getCurrentCash().add(amount))
                    .build());
            log.debug("Released {} on account {}", amount, accountId);
        });
    }

    /**
     * Posts a signed cash delta (sale proceeds or realized P&L).
     *
     * @throws IllegalStateException if the delta would make cash negative
     */
    public void applyPnl(Long accountId, BigDecimal delta) {
        accountLockManager.runWithLock(accountId, () -> {
            Account account = getAccount(accountId);
            BigDecimal newCash = account.getCurrentCash().add(delta);
            if (newCash.signum() < 0) {
                throw new IllegalStateException(String.format(
                        "Posting %s to account %s would make cash negative (%s)", delta, accountId, newCash));
            }
            accountRepository.save(account.toBuilder().currentCash(newCash).build());
            log.debug("Applied {} to account {}, cash now {}", delta, accountId, newCash);
        });
    }

    public void setActive(Long accountId, boolean active) {
        accountLockManager.runWithLock(accountId, () -> {
            Account account = getAccount(accountId);
            accountRepository.save(account.toBuilder().active(active).build());
            log.info("Account {} {}", accountId, active ? "activated" : "deactivated");
        });
    }

    private static void requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative: " + amount);
        }
    }
}
