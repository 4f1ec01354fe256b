package com.poufmaker.api.controller;

import com.poufmaker.api.dto.ConversationCreateRequest;
import com.poufmaker.api.dto.ConversationCreatedDTO;
import com.poufmaker.api.dto.ConversationDTO;
import com.poufmaker.api.dto.InfoResponse;
import com.poufmaker.api.dto.MessageCreateRequest;
import com.poufmaker.api.dto.MessageDTO;
import com.poufmaker.api.security.AuthenticatedUser;
import com.poufmaker.api.service.ConversationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {
    private final ConversationService conversationService;

    @GetMapping
    public ResponseEntity<List<ConversationDTO>> listConversations(@AuthenticationPrincipal AuthenticatedUser principal,
                                                                   @RequestParam(required = false) UUID userId) {
        return ResponseEntity.ok(conversationService.listConversations(principal, userId));
    }

    // The principal is null for anonymous visitors.
    @PostMapping
    public ResponseEntity<ConversationCreatedDTO> createConversation(@AuthenticationPrincipal AuthenticatedUser principal,
                                                                     @RequestBody ConversationCreateRequest request) {
        return new ResponseEntity<>(conversationService.createConversation(principal, request), HttpStatus.CREATED);
    }

    @GetMapping("/{conversationId}")
    public ResponseEntity<ConversationDTO> getConversation(@PathVariable UUID conversationId) {
        return ResponseEntity.ok(conversationService.getConversation(conversationId));
    }

    @DeleteMapping("/{conversationId}")
    public ResponseEntity<InfoResponse> deleteConversation(@AuthenticationPrincipal AuthenticatedUser principal,
                                                           @PathVariable UUID conversationId) {
        conversationService.deleteConversation(principal, conversationId);
        return ResponseEntity.ok(new InfoResponse("Conversation deleted successfully"));
    }

    @GetMapping("/{conversationId}/messages")
    public ResponseEntity<List<MessageDTO>> listMessages(@PathVariable UUID conversationId,
                                                         @RequestParam(required = false) Integer limit,
                                                         @RequestParam(required = false) String before) {
        return ResponseEntity.ok(conversationService.listMessages(conversationId, limit, before));
    }

    @PostMapping("/{conversationId}/messages")
    public ResponseEntity<MessageDTO> appendMessage(@PathVariable UUID conversationId,
                                                    @RequestBody MessageCreateRequest request) {
        MessageDTO message = conversationService.appendMessage(conversationId, request.getContent(), request.getIsUser());
        return new ResponseEntity<>(message, HttpStatus.CREATED);
    }
}
