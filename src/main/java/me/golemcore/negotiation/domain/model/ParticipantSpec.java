package me.golemcore.negotiation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Roster entry requested by a caller. The position in the roster is the
 * participant's order index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantSpec {
    private String id;
    private ParticipantKind kind;
    private String instruction;
}
