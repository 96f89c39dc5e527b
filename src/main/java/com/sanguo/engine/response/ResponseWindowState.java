package com.sanguo.engine.response;

/**
 * Lifecycle of a response window.
 */
public enum ResponseWindowState {
    PENDING,
    POLLING,
    CLOSED
}
