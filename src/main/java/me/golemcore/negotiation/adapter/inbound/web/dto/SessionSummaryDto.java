package me.golemcore.negotiation.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummaryDto {
    private String id;
    private String state;
    private String outcome;
    private int attempt;
    private String coordinatorId;
    private String currentParticipantId;
    private List<String> generatedParticipants;
    private List<String> manualParticipants;
    private int utteranceCount;
    private String createdAt;
}
