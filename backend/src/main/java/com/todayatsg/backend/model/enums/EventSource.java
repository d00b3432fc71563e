package com.todayatsg.backend.model.enums;

/**
 * How an event entered the system.
 */
public enum EventSource {
    USER_SUBMISSION,
    SCRAPED,
    ADMIN
}
