package com.alari.companion.controller;

import com.alari.companion.controller.dto.ConversationCreateRequestDto;
import com.alari.companion.controller.dto.ConversationListResponseDto;
import com.alari.companion.controller.dto.ConversationResponseDto;
import com.alari.companion.controller.dto.MessageResponseDto;
import com.alari.companion.conversation.ConversationService;
import com.alari.companion.security.IdentityGate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/conversations")
@Validated
public class ConversationsController {

    private final ConversationService conversationService;
    private final IdentityGate identityGate;

    public ConversationsController(ConversationService conversationService, IdentityGate identityGate) {
        this.conversationService = conversationService;
        this.identityGate = identityGate;
    }

    @PostMapping
    public ResponseEntity<ConversationResponseDto> create(@Valid @RequestBody(required = false) ConversationCreateRequestDto request) {
        String title = request != null ? request.title() : null;
        var view = conversationService.start(identityGate.authenticate(), title);
        return ResponseEntity.status(HttpStatus.CREATED).body(ConversationResponseDto.from(view));
    }

    @GetMapping
    public ConversationListResponseDto list(@RequestParam(value = "limit", required = false) @Min(1) @Max(500) Integer limit) {
        List<ConversationResponseDto> conversations = conversationService.list(identityGate.authenticate(), limit).stream()
                .map(ConversationResponseDto::from)
                .toList();
        return new ConversationListResponseDto(conversations, conversations.size());
    }

    @GetMapping("/{sessionId}")
    public ConversationResponseDto get(@PathVariable("sessionId") String sessionId) {
        return ConversationResponseDto.from(conversationService.get(identityGate.authenticate(), sessionId));
    }

    @GetMapping("/{sessionId}/messages")
    public List<MessageResponseDto> messages(@PathVariable("sessionId") String sessionId) {
        return conversationService.messages(identityGate.authenticate(), sessionId).stream()
                .map(MessageResponseDto::from)
                .toList();
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> delete(@PathVariable("sessionId") String sessionId) {
        conversationService.delete(identityGate.authenticate(), sessionId);
        return ResponseEntity.noContent().build();
    }
}
