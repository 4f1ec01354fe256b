package com.poufmaker.api.service;

import com.poufmaker.api.dto.ConversationCreateRequest;
import com.poufmaker.api.dto.ConversationCreatedDTO;
import com.poufmaker.api.dto.ConversationDTO;
import com.poufmaker.api.dto.MessageDTO;
import com.poufmaker.api.dto.UserSummaryDTO;
import com.poufmaker.api.entity.Conversation;
import com.poufmaker.api.entity.Message;
import com.poufmaker.api.exception.InvalidRequestException;
import com.poufmaker.api.exception.ResourceNotFoundException;
import com.poufmaker.api.exception.UnauthorizedAccessException;
import com.poufmaker.api.repository.ConversationRepository;
import com.poufmaker.api.repository.MessageRepository;
import com.poufmaker.api.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    public static final int DEFAULT_MESSAGE_LIMIT = 50;
    public static final int MAX_MESSAGE_LIMIT = 200;

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final UserDirectoryService userDirectory;

    /**
     * Opens a conversation with its first message. Visitors without a token may open
     * one too, in which case only the contact details from the request are stored.
     */
    @Transactional
    public ConversationCreatedDTO createConversation(AuthenticatedUser principal, ConversationCreateRequest request) {
        if (isBlank(request.getInitialMessage())) {
            throw new InvalidRequestException("Initial message is required");
        }

        Instant now = Instant.now();
        Conversation conversation = conversationRepository.saveAndFlush(Conversation.builder()
                .userId(principal != null ? principal.userId() : null)
                .userName(request.getUserName())
                .userPhone(request.getUserPhone())
                .createdAt(now)
                .updatedAt(now)
                .build());

        Message first = messageRepository.save(Message.builder()
                .conversationId(conversation.getId())
                .content(request.getInitialMessage())
                .isUser(true)
                .createdAt(now)
                .build());

        log.info("Conversation {} opened{}", conversation.getId(),
                principal != null ? " by " + principal.userId() : " anonymously");
        MessageDTO message = MessageDTO.fromEntity(first);
        return new ConversationCreatedDTO(
                ConversationDTO.fromEntity(conversation, summaryOf(conversation), List.of(message)),
                message);
    }

    @Transactional
    public MessageDTO appendMessage(UUID conversationId, String content, Boolean isUser) {
        Conversation conversation = findConversation(conversationId);
        if (isBlank(content)) {
            throw new InvalidRequestException("Message content is required");
        }

        Instant now = Instant.now();
        Message message = messageRepository.save(Message.builder()
                .conversationId(conversationId)
                .content(content)
                .isUser(isUser == null || isUser)
                .createdAt(now)
                .build());
        conversation.setUpdatedAt(now);
        return MessageDTO.fromEntity(message);
    }

    /**
     * Returns messages newest first. {@code before} is an ISO-8601 instant; only
     * messages strictly older than it are returned.
     */
    @Transactional(readOnly = true)
    public List<MessageDTO> listMessages(UUID conversationId, Integer limit, String before) {
        findConversation(conversationId);
        Pageable page = PageRequest.of(0, clampLimit(limit));

        List<Message> messages;
        if (before != null && !before.isBlank()) {
            messages = messageRepository.findByConversationIdAndCreatedAtBeforeOrderByCreatedAtDesc(
                    conversationId, parseInstant(before), page);
        } else {
            messages = messageRepository.findByConversationIdOrderByCreatedAtDesc(conversationId, page);
        }
        return messages.stream().map(MessageDTO::fromEntity).toList();
    }

    /**
     * Conversations newest activity first, each with its latest message. Admins see
     * every conversation or filter by {@code userId}; other users see only their own.
     */
    @Transactional(readOnly = true)
    public List<ConversationDTO> listConversations(AuthenticatedUser principal, UUID userId) {
        AuthenticatedUser.require(principal);
        List<Conversation> conversations;
        if (principal.role().isAdministrator()) {
            conversations = userId != null
                    ? conversationRepository.findByUserIdOrderByUpdatedAtDesc(userId)
                    : conversationRepository.findAllByOrderByUpdatedAtDesc();
        } else {
            if (userId != null && !userId.equals(principal.userId())) {
                throw new UnauthorizedAccessException("Not authorized to view these conversations");
            }
            conversations = conversationRepository.findByUserIdOrderByUpdatedAtDesc(principal.userId());
        }

        Map<UUID, UserSummaryDTO> users = userDirectory.findSummaries(
                conversations.stream().map(Conversation::getUserId).toList());
        return conversations.stream()
                .map(c -> {
                    List<MessageDTO> latest = messageRepository.findFirstByConversationIdOrderByCreatedAtDesc(c.getId())
                            .map(MessageDTO::fromEntity)
                            .map(List::of)
                            .orElse(List.of());
                    UserSummaryDTO user = c.getUserId() != null ? users.get(c.getUserId()) : null;
                    return ConversationDTO.fromEntity(c, user, latest);
                })
                .toList();
    }

    @Transactional(readOnly = true)
    public ConversationDTO getConversation(UUID conversationId) {
        Conversation conversation = findConversation(conversationId);
        List<MessageDTO> messages = messageRepository.findByConversationIdOrderByCreatedAtDesc(conversationId).stream()
                .map(MessageDTO::fromEntity)
                .toList();
        return ConversationDTO.fromEntity(conversation, summaryOf(conversation), messages);
    }

    @Transactional
    public void deleteConversation(AuthenticatedUser principal, UUID conversationId) {
        AuthenticatedUser.require(principal);
        Conversation conversation = findConversation(conversationId);

        boolean isOwner = conversation.getUserId() != null && conversation.getUserId().equals(principal.userId());
        if (!isOwner && !principal.role().isAdministrator()) {
            throw new UnauthorizedAccessException("Not authorized to delete this conversation");
        }

        int removed = messageRepository.deleteByConversationId(conversationId);
        conversationRepository.delete(conversation);
        log.info("Conversation {} deleted with {} message(s) by {}", conversationId, removed, principal.userId());
    }

    private Conversation findConversation(UUID conversationId) {
        return conversationRepository.findById(conversationId)
                .orElseThrow(() -> new ResourceNotFoundException("Conversation not found"));
    }

    private UserSummaryDTO summaryOf(Conversation conversation) {
        if (conversation.getUserId() == null) {
            return null;
        }
        return userDirectory.findSummaries(List.of(conversation.getUserId())).get(conversation.getUserId());
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_MESSAGE_LIMIT;
        }
        return Math.max(1, Math.min(MAX_MESSAGE_LIMIT, limit));
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("Invalid 'before' timestamp: " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
