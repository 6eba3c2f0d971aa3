package io.vocalis.core.memory.prompt;

import io.vocalis.core.model.CategorySummary;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the live system prompt from base instructions and retrieved category summaries.
 *
 * <p>Layout: the base text, then the memory header, then one {@code **name:** summary} section per
 * category that carries a summary, in retrieval order. Sections and header are separated by a blank
 * line. Categories without summary text are left out; when none remain the base text is returned as
 * is. Output depends only on the arguments.
 */
public final class PromptComposer {
    public static final String DEFAULT_MEMORY_HEADER = "Here's what you know about the user:";
    static final String DELIMITER = "\n\n";

    private final String memoryHeader;

    public PromptComposer() {
        this(DEFAULT_MEMORY_HEADER);
    }

    public PromptComposer(String memoryHeader) {
        this.memoryHeader = memoryHeader == null || memoryHeader.isBlank() ? DEFAULT_MEMORY_HEADER : memoryHeader.trim();
    }

    public String build(String base, List<CategorySummary> summaries) {
        return compose(base, summaries).text();
    }

    public SystemPrompt compose(String base, List<CategorySummary> summaries) {
        String safeBase = base == null ? "" : base;
        List<CategorySummary> retained = new ArrayList<>();
        if (summaries != null) {
            for (CategorySummary summary : summaries) {
                if (summary != null && summary.hasSummary() && !summary.categoryName().isBlank()) {
                    retained.add(summary);
                }
            }
        }
        if (retained.isEmpty()) {
            return SystemPrompt.base(safeBase);
        }

        StringBuilder text = new StringBuilder(safeBase);
        if (!safeBase.isEmpty()) {
            text.append(DELIMITER);
        }
        text.append(memoryHeader);
        for (CategorySummary summary : retained) {
            text.append(DELIMITER)
                .append("**").append(summary.categoryName()).append(":** ")
                .append(summary.summaryText());
        }
        return new SystemPrompt(safeBase, retained, text.toString());
    }
}
