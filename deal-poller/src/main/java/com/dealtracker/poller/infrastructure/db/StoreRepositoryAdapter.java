package com.dealtracker.poller.infrastructure.db;

import com.dealtracker.poller.domain.listing.Store;
import com.dealtracker.poller.domain.persistence.StorePort;
import com.dealtracker.poller.infrastructure.db.mapper.StoreRowMapper;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class StoreRepositoryAdapter implements StorePort {

    private final StoreJpaRepository jpaRepository;
    private final StoreRowMapper mapper;

    @Override
    @Transactional
    public void upsertStore(Store store, Instant seenAt) {
        jpaRepository.upsert(mapper.toRow(store, seenAt));
    }
}
