package io.vocalis.core.memory.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.vocalis.core.model.CategorySummary;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes the category listings returned by the memory service. Two encodings are accepted and may
 * be mixed within one response:
 * <ul>
 *   <li>structured objects, {@code {"name": "...", "summary": "..."}}</li>
 *   <li>key/value mappings, either the whole {@code categories} node as {@code {name: summary}} or an
 *   array item holding a single {@code {name: summary}} entry</li>
 * </ul>
 * Entries that cannot be normalized are reported and skipped, they never fail the whole listing.
 */
public final class CategoryNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(CategoryNormalizer.class);

    public List<CategorySummary> normalize(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }
        JsonNode categories = root.isArray() ? root : root.path("categories");
        List<CategorySummary> out = new ArrayList<>();
        if (categories.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = categories.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                add(out, field.getKey(), field.getValue());
            }
        } else if (categories.isArray()) {
            for (JsonNode item : categories) {
                addItem(out, item);
            }
        } else if (!categories.isMissingNode() && !categories.isNull()) {
            LOG.warn("Ignoring category listing of unexpected type {}", categories.getNodeType());
        }
        return List.copyOf(out);
    }

    private void addItem(List<CategorySummary> out, JsonNode item) {
        if (item.isObject() && item.has("name")) {
            add(out, item.path("name").asText(""), item.path("summary"));
            return;
        }
        if (item.isObject() && item.size() == 1) {
            Map.Entry<String, JsonNode> entry = item.fields().next();
            add(out, entry.getKey(), entry.getValue());
            return;
        }
        LOG.warn("Skipping category entry that has neither a name nor a single key: {}", truncate(item.toString()));
    }

    private void add(List<CategorySummary> out, String name, JsonNode summaryNode) {
        if (name == null || name.isBlank()) {
            LOG.warn("Skipping category entry without a name");
            return;
        }
        try {
            out.add(new CategorySummary(name, summaryText(summaryNode)));
        } catch (CategoryFormatException e) {
            LOG.warn("Category {} has an unreadable summary, treating it as empty: {}", name, e.getMessage());
            out.add(new CategorySummary(name, null));
        }
    }

    private String summaryText(JsonNode node) throws CategoryFormatException {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isObject()) {
            return summaryText(node.path("summary"));
        }
        throw new CategoryFormatException("expected text but found " + node.getNodeType());
    }

    private String truncate(String value) {
        if (value.length() <= 120) {
            return value;
        }
        return value.substring(0, 120) + "...";
    }
}
