package io.vocalis.core.session;

import java.util.concurrent.atomic.AtomicReference;

public final class InMemoryLiveSession implements LiveSession {
    private final AtomicReference<String> instructions;

    public InMemoryLiveSession(String initialInstructions) {
        this.instructions = new AtomicReference<>(initialInstructions == null ? "" : initialInstructions);
    }

    @Override
    public String currentInstructions() {
        return instructions.get();
    }

    @Override
    public void updateInstructions(String instructions) {
        this.instructions.set(instructions == null ? "" : instructions);
    }
}
