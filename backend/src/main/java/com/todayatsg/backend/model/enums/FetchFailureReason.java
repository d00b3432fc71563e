package com.todayatsg.backend.model.enums;

public enum FetchFailureReason {
    HTTP_STATUS,
    TIMEOUT,
    IO,
    ROBOTS_DISALLOWED
}
