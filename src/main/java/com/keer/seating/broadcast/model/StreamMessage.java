package com.keer.seating.broadcast.model;

import com.keer.seating.seating.dto.SeatingSnapshot;

/**
 * Wire message of the live-update protocol: {@code {type: SNAPSHOT|DELTA, sequence, payload}}.
 */
public record StreamMessage(Type type, long sequence, Object payload) {

    public enum Type {
        SNAPSHOT, DELTA
    }

    public static StreamMessage snapshot(SeatingSnapshot snapshot) {
        return new StreamMessage(Type.SNAPSHOT, snapshot.sequence(), snapshot);
    }

    public static StreamMessage delta(Delta delta) {
        return new StreamMessage(Type.DELTA, delta.sequence(), delta);
    }
}
