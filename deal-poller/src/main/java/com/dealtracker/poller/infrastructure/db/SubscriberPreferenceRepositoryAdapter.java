package com.dealtracker.poller.infrastructure.db;

import com.dealtracker.poller.domain.notification.PreferenceProvider;
import com.dealtracker.poller.domain.notification.SubscriberPreference;
import com.dealtracker.poller.infrastructure.db.mapper.SubscriberPreferenceRowMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class SubscriberPreferenceRepositoryAdapter implements PreferenceProvider {

    private final SubscriberPreferenceJpaRepository jpaRepository;
    private final SubscriberPreferenceRowMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public List<SubscriberPreference> listSubscribers(String regionKey) {
        return jpaRepository.findByRegionKey(regionKey).stream().map(mapper::toDomain).toList();
    }
}
