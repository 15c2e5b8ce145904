package com.tradingstation.unit.account;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradingstation.account.AccountLedger;
import com.tradingstation.account.AccountLockManager;
import com.tradingstation.domain.model.Account;
import com.tradingstation.exception.ErrorCode;
import com.tradingstation.exception.ResourceNotFoundException;
import com.tradingstation.repository.memory.InMemoryAccountRepository;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AccountLedgerTest {

    private AccountLedger accountLedger;
    private Long accountId;

    @BeforeEach
    void setUp() {
        accountLedger = new AccountLedger(new InMemoryAccountRepository(), new AccountLockManager());
        accountId = accountLedger.openAccount("primary", new BigDecimal("100000")).getId();
    }

    @Test
    @DisplayName("New account starts active with cash equal to initial capital")
    void openAccount_cashEqualsCapital() {
        Account account = accountLedger.getAccount(accountId);

        assertThat(account.isActive()).isTrue();
        assertThat(account.getCurrentCash()).isEqualByComparingTo("100000");
        assertThat(account.getInitialCapital()).isEqualByComparingTo("100000");
    }

    @Test
    @DisplayName("Unknown account fails with NOT_FOUND")
    void unknownAccount_notFound() {
        assertThatThrownBy(() -> accountLedger.getAccount(999L))
                .isInstanceOf(ResourceNotFoundException.class)
                .satisfies(e -> assertThat(((ResourceNotFoundException) e).getErrorCode())
                        .isEqualTo(ErrorCode.NOT_FOUND));
    }

    @Test
    @DisplayName("Non-positive initial capital is rejected")
    void openAccount_nonPositiveCapital() {
        assertThatThrownBy(() -> accountLedger.openAccount("empty", BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Reservations")
    class Reservations {

        @Test
        @DisplayName("Reserving within available cash debits it")
        void reserve_debits() {
            assertThat(accountLedger.reserveFunds(accountId, new BigDecimal("15005"))).isTrue();

            assertThat(accountLedger.getAvailableBalance(accountId)).isEqualByComparingTo("84995");
        }

        @Test
        @DisplayName("Reserving exactly the available cash succeeds")
        void reserve_exactBalance() {
            assertThat(accountLedger.reserveFunds(accountId, new BigDecimal("100000"))).isTrue();

            assertThat(accountLedger.getAvailableBalance(accountId)).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Reserving more than available fails and leaves cash unchanged")
        void reserve_insufficient() {
            assertThat(accountLedger.reserveFunds(accountId, new BigDecimal("100000.01"))).isFalse();

            assertThat(accountLedger.getAvailableBalance(accountId)).isEqualByComparingTo("100000");
        }

        @Test
        @DisplayName("Release credits the reservation back")
        void release_credits() {
            accountLedger.reserveFunds(accountId, new BigDecimal("2500"));
            accountLedger.releaseFunds(accountId, new BigDecimal("2500"));

            assertThat(accountLedger.getAvailableBalance(accountId)).isEqualByComparingTo("100000");
        }

        @Test
        @DisplayName("Negative amounts are rejected")
        void negativeAmount() {
            assertThatThrownBy(() -> accountLedger.reserveFunds(accountId, new BigDecimal("-1")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Concurrent reservations never overdraw the account")
        void concurrentReservations_neverOverdraw() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Callable<Boolean>> tasks = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    tasks.add(() -> accountLedger.reserveFunds(accountId, new BigDecimal("1000")));
                }
                int successes = 0;
                for (Future<Boolean> f : pool.invokeAll(tasks)) {
                    if (f.get()) {
                        successes++;
                    }
                }

                assertThat(successes).isEqualTo(100);
                assertThat(accountLedger.getAvailableBalance(accountId)).isEqualByComparingTo("0");
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("P&L postings")
    class PnlPostings {

        @Test
        @DisplayName("Positive and negative deltas adjust cash")
        void applyPnl_adjustsCash() {
            accountLedger.applyPnl(accountId, new BigDecimal("1000"));
            accountLedger.applyPnl(accountId, new BigDecimal("-250.50"));

            assertThat(accountLedger.getAvailableBalance(accountId)).isEqualByComparingTo("100749.50");
        }

        @Test
        @DisplayName("A delta that would make cash negative is refused")
        void applyPnl_negativeCash_refused() {
            assertThatThrownBy(() -> accountLedger.applyPnl(accountId, new BigDecimal("-100000.01")))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(accountLedger.getAvailableBalance(accountId)).isEqualByComparingTo("100000");
        }
    }

    @Test
    @DisplayName("Deactivating an account is reflected on the next read")
    void setActive_false() {
        accountLedger.setActive(accountId, false);

        assertThat(accountLedger.getAccount(accountId).isActive()).isFalse();
    }
}
