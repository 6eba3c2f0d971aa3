package io.vocalis.core.memory.prompt;

import io.vocalis.core.model.CategorySummary;
import java.util.List;

/** A composed system prompt; {@code text} is always derived from the base and summaries by {@link PromptComposer}. */
public record SystemPrompt(String base, List<CategorySummary> integratedSummaries, String text) {

    public SystemPrompt {
        base = base == null ? "" : base;
        integratedSummaries = integratedSummaries == null ? List.of() : List.copyOf(integratedSummaries);
        text = text == null ? base : text;
    }

    public static SystemPrompt base(String base) {
        return new SystemPrompt(base, List.of(), base);
    }

    public boolean hasMemory() {
        return !integratedSummaries.isEmpty();
    }
}
