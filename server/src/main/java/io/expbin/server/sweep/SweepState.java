package io.expbin.server.sweep;

/** Lifecycle of a sweep job. Every state but RUNNING is terminal. */
public enum SweepState {
    RUNNING,
    DONE,
    CANCELLED,
    TIMED_OUT,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
