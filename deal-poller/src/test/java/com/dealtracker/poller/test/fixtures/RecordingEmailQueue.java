package com.dealtracker.poller.test.fixtures;

import com.dealtracker.common.event.EmailDigest;
import com.dealtracker.poller.domain.notification.EmailQueue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class RecordingEmailQueue implements EmailQueue {

    public final List<EmailDigest> digests = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void enqueue(String userId, EmailDigest digest) {
        digests.add(digest);
    }
}
