package com.comma.counseling.service.chats;

import com.comma.counseling.models.Message;
import com.comma.counseling.security.AuthenticatedParticipant;

import java.util.List;
import java.util.UUID;

public interface ChatService {
    Message sendMessage(UUID sessionId, AuthenticatedParticipant sender, String content);
    List<Message> getHistory(UUID sessionId, AuthenticatedParticipant reader, int skip, int limit);
}
