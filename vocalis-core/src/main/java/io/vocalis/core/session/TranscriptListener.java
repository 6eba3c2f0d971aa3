package io.vocalis.core.session;

import io.vocalis.core.memory.CloseReport;
import io.vocalis.core.memory.MemoryCoordinator;
import io.vocalis.core.model.ConversationTurn;
import io.vocalis.core.model.TurnRole;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges conversation events of a speech session into the memory pipeline. Items arrive as a role and
 * a list of content parts; only non-blank user and assistant items become turns.
 */
public final class TranscriptListener {
    private static final Logger LOG = LoggerFactory.getLogger(TranscriptListener.class);

    private final MemoryCoordinator coordinator;
    private final Clock clock;

    public TranscriptListener(MemoryCoordinator coordinator, Clock clock) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /** @return whether the item was forwarded as a turn */
    public boolean onConversationItem(String role, List<String> contentParts) {
        String text = contentParts == null ? "" : String.join("", contentParts).trim();
        if (text.isEmpty()) {
            LOG.debug("Ignoring conversation item with empty content, role={}", role);
            return false;
        }
        TurnRole turnRole;
        try {
            turnRole = TurnRole.parse(role);
        } catch (IllegalArgumentException e) {
            LOG.debug("Ignoring conversation item with role {}", role);
            return false;
        }
        coordinator.onTurn(new ConversationTurn(turnRole, text, clock.instant()));
        return true;
    }

    public CloseReport onSessionClosed(String reason) {
        LOG.info("Voice session closed, reason={}", reason == null ? "unspecified" : reason);
        CloseReport report = coordinator.onClose();
        LOG.info(
            "Memory pipeline closed: {} final turns submitted, {} tasks abandoned",
            report.finalBatchSize(),
            report.abandonedTasks()
        );
        return report;
    }
}
