package com.edurange.ctf.modules.instance;

/**
 * PENDING → RUNNING, PENDING|RUNNING → FAILED, PENDING|RUNNING → TERMINATED.
 * FAILED and TERMINATED are terminal.
 */
public enum InstanceStatus {
    PENDING, RUNNING, FAILED, TERMINATED;

    public boolean isTerminal() {
        return this == FAILED || this == TERMINATED;
    }

    public boolean canTransitionTo(InstanceStatus target) {
        if (isTerminal() || target == this) {
            return false;
        }
        return switch (target) {
            case RUNNING -> this == PENDING;
            case FAILED, TERMINATED -> true;
            case PENDING -> false;
        };
    }

    /** Who last wrote {@code status}. */
    public enum Source {
        /** A local request (stop, failure report); not proof the backend agrees. */
        LOCAL,
        /** Observed from an orchestration backend response. */
        BACKEND
    }
}
