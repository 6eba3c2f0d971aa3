package io.vocalis.core.model;

import java.util.Optional;

public record CategorySummary(String categoryName, String summaryText) {

    public CategorySummary {
        categoryName = categoryName == null ? "" : categoryName.trim();
        summaryText = summaryText == null || summaryText.isBlank() ? null : summaryText.trim();
    }

    public Optional<String> summary() {
        return Optional.ofNullable(summaryText);
    }

    public boolean hasSummary() {
        return summaryText != null;
    }
}
