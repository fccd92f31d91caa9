package com.dealtracker.poller.infrastructure.db;

import com.dealtracker.poller.domain.history.PriceObservationPort;
import com.dealtracker.poller.domain.listing.PriceObservation;
import com.dealtracker.poller.infrastructure.db.mapper.ListingRowMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class PriceObservationRepositoryAdapter implements PriceObservationPort {

    private final PriceObservationJpaRepository jpaRepository;
    private final ListingRowMapper mapper;

    @Override
    @Transactional
    public void append(PriceObservation observation) {
        jpaRepository.append(mapper.toRow(observation));
    }

    @Override
    @Transactional(readOnly = true)
    public List<PriceObservation> findHistory(String storeId, String listingId) {
        return jpaRepository.findByStoreIdAndListingExternalIdOrderByObservedAtAscIdAsc(storeId, listingId)
                .stream()
                .map(mapper::toDomain)
                .toList();
    }
}
