package com.todayatsg.backend.model.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DedupDecision {

    public enum Type {
        NEW,
        DUPLICATE
    }

    private static final DedupDecision NEW_EVENT = new DedupDecision(Type.NEW, null, null);

    private final Type type;
    private final Long existingId;
    private final String reason;

    public static DedupDecision newEvent() {
        return NEW_EVENT;
    }

    public static DedupDecision duplicateOf(Long existingId, String reason) {
        return new DedupDecision(Type.DUPLICATE, existingId, reason);
    }

    public boolean isDuplicate() {
        return type == Type.DUPLICATE;
    }
}
