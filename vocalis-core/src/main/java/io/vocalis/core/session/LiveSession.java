package io.vocalis.core.session;

/**
 * The instruction slot of a running voice session. The response path reads it on every turn; only the
 * memory pipeline replaces it.
 */
public interface LiveSession {
    String currentInstructions();

    /** Replaces the whole value at once; readers see either the previous or the new string. */
    void updateInstructions(String instructions);
}
