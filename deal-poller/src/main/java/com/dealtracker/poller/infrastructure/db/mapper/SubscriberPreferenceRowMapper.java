package com.dealtracker.poller.infrastructure.db.mapper;

import com.dealtracker.poller.domain.notification.NotificationWindow;
import com.dealtracker.poller.domain.notification.SubscriberPreference;
import com.dealtracker.poller.infrastructure.db.SubscriberPreferenceRow;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface SubscriberPreferenceRowMapper {

    @Mapping(target = "window", expression = "java(toWindow(row))")
    SubscriberPreference toDomain(SubscriberPreferenceRow row);

    /** No stored window, or half of one, means any time of day. */
    default NotificationWindow toWindow(SubscriberPreferenceRow row) {
        if (row.getWindowStart() == null || row.getWindowEnd() == null) {
            return NotificationWindow.ALL_DAY;
        }
        return new NotificationWindow(row.getWindowStart(), row.getWindowEnd());
    }
}
