package com.dealtracker.poller.domain.notification;

public record FanOutReport(int liveMessages, int emailsEnqueued, int emailsDropped) {}
