package com.tradingstation.repository;

import com.tradingstation.domain.model.Account;
import java.util.List;
import java.util.Optional;

/**
 * Storage port for accounts. The engine core never creates accounts implicitly; new
 * accounts are assigned an id by the store on first save.
 */
public interface AccountRepository {

    Optional<Account> findById(Long id);

    List<Account> findAll();

    /** Inserts (id == null) or replaces the stored account. Returns the stored record. */
    Account save(Account account);
}
