package com.todayatsg.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class WriteOutcome {

    public enum Action {
        INSERTED,
        UPDATED
    }

    private final Action action;
    private final Long eventId;

    public boolean isInserted() {
        return action == Action.INSERTED;
    }
}
