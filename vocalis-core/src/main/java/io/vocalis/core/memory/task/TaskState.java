package io.vocalis.core.memory.task;

public enum TaskState {
    PENDING,
    COMPLETED,
    FAILED,
    ABANDONED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
