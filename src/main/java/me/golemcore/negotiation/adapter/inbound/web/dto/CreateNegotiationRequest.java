package me.golemcore.negotiation.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateNegotiationRequest {
    private String sessionId;
    private String coordinatorId;
    @Builder.Default
    private List<ParticipantRequest> participants = new ArrayList<>();
}
