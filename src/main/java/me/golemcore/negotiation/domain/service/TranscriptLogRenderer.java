package me.golemcore.negotiation.domain.service;

import me.golemcore.negotiation.domain.model.Utterance;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders a session's full history as a Markdown log, one section per attempt.
 */
@Component
public class TranscriptLogRenderer {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    public TranscriptLogRenderer(Clock clock) {
        this.clock = clock;
    }

    public String render(NegotiationSession session) {
        StringBuilder markdown = new StringBuilder();
        markdown.append("# Negotiation log\n");
        markdown.append("- Session: ").append(session.getId()).append('\n');
        markdown.append("- Exported: ").append(ZonedDateTime.now(clock).format(TIMESTAMP_FORMAT)).append('\n');
        markdown.append("- State: ").append(session.getState()).append('\n');
        markdown.append("- Attempts: ").append(session.getAttemptCount()).append('\n');

        List<Utterance> history = session.getHistory();
        if (history.isEmpty()) {
            markdown.append("\n_No messages yet._\n");
            return markdown.toString();
        }

        int currentAttempt = -1;
        for (Utterance utterance : history) {
            if (utterance.attempt() != currentAttempt) {
                currentAttempt = utterance.attempt();
                markdown.append("\n## Attempt ").append(currentAttempt).append('\n');
            }
            markdown.append("- **[").append(utterance.speakerId()).append("]** ")
                    .append(utterance.text()).append('\n');
        }
        return markdown.toString();
    }
}
