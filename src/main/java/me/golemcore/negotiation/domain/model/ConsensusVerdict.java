package me.golemcore.negotiation.domain.model;

import java.util.List;

/**
 * Result of validating one transcript segment. {@code candidateIndex} is the
 * position of the coordinator's agreement inside the segment, or {@code -1}
 * when there is none.
 */
public record ConsensusVerdict(boolean valid, int candidateIndex, List<String> missingAffirmations) {

    public static final int NO_CANDIDATE = -1;

    public ConsensusVerdict {
        missingAffirmations = missingAffirmations != null ? List.copyOf(missingAffirmations) : List.of();
    }

    public static ConsensusVerdict noCandidate() {
        return new ConsensusVerdict(false, NO_CANDIDATE, List.of());
    }

    public boolean hasCandidate() {
        return candidateIndex != NO_CANDIDATE;
    }
}
