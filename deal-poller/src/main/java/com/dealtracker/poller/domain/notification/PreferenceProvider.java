package com.dealtracker.poller.domain.notification;

import java.util.List;

public interface PreferenceProvider {

    List<SubscriberPreference> listSubscribers(String regionKey);
}
