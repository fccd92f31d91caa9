package com.dealtracker.poller.infrastructure.db;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubscriberPreferenceJpaRepository extends JpaRepository<SubscriberPreferenceRow, String> {

    List<SubscriberPreferenceRow> findByRegionKey(String regionKey);
}
