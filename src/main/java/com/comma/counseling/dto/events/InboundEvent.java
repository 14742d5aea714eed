package com.comma.counseling.dto.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client frame. Which fields are meaningful depends on {@code type}:
 * {@code chat_message} uses content, {@code typing} uses isTyping,
 * {@code session_action} uses action and counselorNotes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundEvent {
    public static final String CHAT_MESSAGE = "chat_message";
    public static final String TYPING = "typing";
    public static final String SESSION_ACTION = "session_action";

    public static final String START_SESSION = "start_session";
    public static final String END_SESSION = "end_session";

    private String type;
    private String content;
    private Boolean isTyping;
    private String action;
    private String counselorNotes;
}
