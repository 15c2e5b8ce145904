package com.tradingstation.repository.memory;

import com.tradingstation.domain.model.Account;
import com.tradingstation.repository.AccountRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryAccountRepository implements AccountRepository {

    private final Map<Long, Account> accounts = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Override
    public Optional<Account> findById(Long id) {
        return id == null ? Optional.empty() : Optional.ofNullable(accounts.get(id));
    }

    @Override
    public List<Account> findAll() {
        List<Account> all = new ArrayList<>(accounts.values());
        all.sort(Comparator.comparing(Account::getId));
        return all;
    }

    @Override
    public Account save(Account account) {
        Account stored = account.getId() == null
                ? account.toBuilder().id(idSequence.incrementAndGet()).build()
                : account;
        accounts.put(stored.getId(), stored);
        return stored;
    }
}
