package com.dealtracker.poller.domain.detection;

import com.dealtracker.poller.domain.listing.Listing;
import com.dealtracker.poller.domain.notification.NotificationEvent;
import java.util.List;

public record DetectionResult(List<ListingChange> changes, List<NotificationEvent> events) {

    public List<Listing> updatedSnapshot() {
        return changes.stream().map(ListingChange::current).toList();
    }

    public List<ListingChange> changesOf(ChangeKind kind) {
        return changes.stream().filter(change -> change.kind() == kind).toList();
    }
}
