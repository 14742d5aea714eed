package com.comma.counseling.service.chats;

import com.comma.counseling.exceptions.InvalidTransitionException;
import com.comma.counseling.exceptions.ValidationException;
import com.comma.counseling.models.ChatSession;
import com.comma.counseling.models.Message;
import com.comma.counseling.repo.ChatSessionJDBCRepository;
import com.comma.counseling.repo.MessageJDBCRepository;
import com.comma.counseling.security.AuthenticatedParticipant;
import com.comma.counseling.service.sessions.ChatSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class ChatServiceImp implements ChatService {
    private final ChatSessionService sessionService;
    private final ChatSessionJDBCRepository sessionRepo;
    private final MessageJDBCRepository msgRepo;
    private final Clock clock;

    @Value("${counseling.messages.max-length:4000}")
    private int maxLength = 4000;

    @Override
    public Message sendMessage(UUID sessionId, AuthenticatedParticipant sender, String content) {
        String text = content == null ? "" : content.strip();
        if (text.isEmpty()) {
            throw new ValidationException("Message content cannot be empty");
        }
        if (text.length() > maxLength) {
            throw new ValidationException("Message content exceeds " + maxLength + " characters");
        }

        ChatSession session = sessionService.getForParticipant(sessionId, sender);

        Message message = Message.builder()
                .sessionId(session.getId())
                .senderId(sender.getId())
                .senderKind(sender.getKind())
                .content(text)
                .createdAt(clock.instant())
                .build();

        return msgRepo.insertIfSessionOpen(message)
                .orElseThrow(() -> new InvalidTransitionException(sessionId,
                        sessionRepo.findById(sessionId).map(ChatSession::getStatus).orElse(session.getStatus()),
                        "send message to"));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Message> getHistory(UUID sessionId, AuthenticatedParticipant reader, int skip, int limit) {
        if (skip < 0 || limit < 1 || limit > 200) {
            throw new ValidationException("skip must be >= 0 and limit between 1 and 200");
        }
        sessionService.getForParticipant(sessionId, reader);
        return msgRepo.findBySessionId(sessionId, skip, limit);
    }
}
