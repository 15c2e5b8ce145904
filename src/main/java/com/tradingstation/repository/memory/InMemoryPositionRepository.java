package com.tradingstation.repository.memory;

import com.tradingstation.domain.enums.PositionStatus;
import com.tradingstation.domain.model.Position;
import com.tradingstation.repository.PositionRepository;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Repository;

/**
 * Positions keyed by id in a sorted map. Ids come from a monotonic sequence, so id order
 * is insertion order and queries return positions oldest first.
 */
@Repository
public class InMemoryPositionRepository implements PositionRepository {

    private final Map<Long, Position> positions = new ConcurrentSkipListMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Override
    public Optional<Position> findById(Long id) {
        return id == null ? Optional.empty() : Optional.ofNullable(positions.get(id));
    }

    @Override
    public List<Position> findByAccountIdAndStatus(Long accountId, PositionStatus status) {
        return positions.values().stream()
                .filter(p -> Objects.equals(p.getAccountId(), accountId))
                .filter(p -> p.getStatus() == status)
                .toList();
    }

    @Override
    public Position save(Position position) {
        Position stored = position.getId() == null
                ? position.toBuilder().id(idSequence.incrementAndGet()).build()
                : position;
        positions.put(stored.getId(), stored);
        return stored;
    }
}
