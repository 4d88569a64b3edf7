package org.bacteria.service.ingestion;

import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class RequestPacer {

    // false once the thread is interrupted; the flag stays set
    public boolean pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
