package me.golemcore.negotiation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request to create a negotiation session. {@code sessionId} and
 * {@code coordinatorId} are optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RosterSpec {
    private String sessionId;
    private String coordinatorId;
    @Builder.Default
    private List<ParticipantSpec> participants = new ArrayList<>();
}
