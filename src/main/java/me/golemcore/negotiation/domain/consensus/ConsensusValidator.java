package me.golemcore.negotiation.domain.consensus;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.negotiation.domain.model.ConsensusVerdict;
import me.golemcore.negotiation.domain.model.Utterance;
import me.golemcore.negotiation.infrastructure.config.NegotiationProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a transcript segment ends in a genuine agreement.
 *
 * <p>
 * A candidate is the first coordinator utterance that, after leading
 * whitespace, starts with the agreement marker and contains the final-plan
 * marker further on. The segment is valid only if every other roster member
 * used one of the affirmation phrases (case-sensitive substring) in an
 * utterance before the candidate.
 *
 * <p>
 * Stateless and safe to share between sessions.
 */
@Component
public class ConsensusValidator {

    private final String agreementMarker;
    private final String finalPlanMarker;
    private final List<String> affirmationPhrases;

    @Autowired
    public ConsensusValidator(NegotiationProperties properties) {
        this(properties.getMarkers().getAgreement(), properties.getMarkers().getFinalPlan(),
                properties.getAffirmationPhrases());
    }

    public ConsensusValidator(String agreementMarker, String finalPlanMarker, List<String> affirmationPhrases) {
        if (agreementMarker == null || agreementMarker.isEmpty()) {
            throw new IllegalArgumentException("agreement marker must not be empty");
        }
        if (finalPlanMarker == null || finalPlanMarker.isEmpty()) {
            throw new IllegalArgumentException("final plan marker must not be empty");
        }
        this.agreementMarker = agreementMarker;
        this.finalPlanMarker = finalPlanMarker;
        this.affirmationPhrases = affirmationPhrases != null
                ? affirmationPhrases.stream().filter(Objects::nonNull).filter(p -> !p.isEmpty()).toList()
                : List.of();
    }

    /**
     * Returns the index of the first candidate agreement in the segment, or
     * {@link ConsensusVerdict#NO_CANDIDATE}.
     */
    public int findCandidate(List<Utterance> segment, String coordinatorId) {
        for (int i = 0; i < segment.size(); i++) {
            Utterance utterance = segment.get(i);
            if (coordinatorId.equals(utterance.speakerId()) && isAgreementDeclaration(utterance.text())) {
                return i;
            }
        }
        return ConsensusVerdict.NO_CANDIDATE;
    }

    public ConsensusVerdict validate(List<Utterance> segment, Collection<String> rosterIds, String coordinatorId) {
        int candidate = findCandidate(segment, coordinatorId);
        if (candidate == ConsensusVerdict.NO_CANDIDATE) {
            return ConsensusVerdict.noCandidate();
        }

        Set<String> affirmed = new LinkedHashSet<>();
        for (int i = 0; i < candidate; i++) {
            Utterance utterance = segment.get(i);
            if (!coordinatorId.equals(utterance.speakerId()) && containsAffirmation(utterance.text())) {
                affirmed.add(utterance.speakerId());
            }
        }

        List<String> missing = new ArrayList<>();
        for (String participantId : rosterIds) {
            if (!participantId.equals(coordinatorId) && !affirmed.contains(participantId)) {
                missing.add(participantId);
            }
        }
        return new ConsensusVerdict(missing.isEmpty(), candidate, missing);
    }

    boolean isAgreementDeclaration(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.stripLeading();
        if (!trimmed.startsWith(agreementMarker)) {
            return false;
        }
        return trimmed.indexOf(finalPlanMarker, agreementMarker.length()) >= 0;
    }

    boolean containsAffirmation(String text) {
        if (text == null) {
            return false;
        }
        for (String phrase : affirmationPhrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
