package com.tessera.pipeline;

import com.tessera.pipeline.notification.NotificationOutcome;
import com.tessera.pipeline.notification.RealtimeMessage;
import com.tessera.pipeline.notification.RealtimeNotifier;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Captures pushes; can be switched to throw. */
public class RecordingNotifier implements RealtimeNotifier {

    private final List<RealtimeMessage> messages = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public NotificationOutcome notify(RealtimeMessage message) {
        messages.add(message);
        if (failing) {
            throw new IllegalStateException("real-time service unreachable");
        }
        return NotificationOutcome.DELIVERED;
    }

    public List<RealtimeMessage> messages() {
        return List.copyOf(messages);
    }

    public void failing(boolean value) {
        this.failing = value;
    }
}
