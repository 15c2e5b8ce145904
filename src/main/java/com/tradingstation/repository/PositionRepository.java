package com.tradingstation.repository;

import com.tradingstation.domain.enums.PositionStatus;
import com.tradingstation.domain.model.Position;
import java.util.List;
import java.util.Optional;

/** Storage port for positions. */
public interface PositionRepository {

    Optional<Position> findById(Long id);

    /** Positions of an account with the given status, in insertion (id) order. */
    List<Position> findByAccountIdAndStatus(Long accountId, PositionStatus status);

    /**
     * Inserts (id == null, a new unique id is assigned) or replaces the stored position.
     * Returns the stored record.
     */
    Position save(Position position);
}
