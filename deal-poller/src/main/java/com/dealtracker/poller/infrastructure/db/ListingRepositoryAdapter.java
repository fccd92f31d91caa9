package com.dealtracker.poller.infrastructure.db;

import com.dealtracker.common.id.UlidGenerator;
import com.dealtracker.poller.domain.listing.Listing;
import com.dealtracker.poller.domain.persistence.ListingSnapshotPort;
import com.dealtracker.poller.infrastructure.db.mapper.ListingRowMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class ListingRepositoryAdapter implements ListingSnapshotPort {

    private final ListingJpaRepository jpaRepository;
    private final ListingRowMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public List<Listing> loadSnapshot(String storeId) {
        return jpaRepository.findByStoreId(storeId).stream().map(mapper::toDomain).toList();
    }

    @Override
    @Transactional
    public void upsertListing(Listing listing) {
        var row = mapper.toRow(listing);
        row.setId(UlidGenerator.generate(listing.firstSeen()));
        jpaRepository.upsert(row);
    }
}
