package me.golemcore.negotiation.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire form of a session event for SSE and WebSocket subscribers. The
 * {@code type} is one of {@code message}, {@code system}, {@code typing} or
 * {@code end}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionEventDto {
    private String type;
    private String sessionId;
    private String speaker;
    private String text;
    private Long sequence;
    private Integer attempt;
    private Boolean active;
    private String timestamp;
}
