package com.sanguo.engine.response;

/**
 * Polls responders in order until one answers or all pass.
 */
public interface ResponseWindow {

    String getWindowId();

    ResponseWindowState getState();

    /**
     * Run the window to completion. A window runs once.
     * @throws IllegalStateException if the window already ran
     */
    ResponseWindowResult execute();
}
