package com.dealtracker.poller.domain.notification;

public record LiveHandle(LiveConnection connection, String regionKey) {}
