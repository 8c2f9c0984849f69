package com.alari.companion.controller;

import com.alari.companion.chat.ChatTurnOrchestrator;
import com.alari.companion.chat.GenerationOptions;
import com.alari.companion.chat.TurnResult;
import com.alari.companion.controller.dto.ChatRequestDto;
import com.alari.companion.controller.dto.ChatResponseDto;
import com.alari.companion.controller.dto.MessageResponseDto;
import com.alari.companion.security.IdentityGate;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/chat")
public class ChatController {

    private final ChatTurnOrchestrator orchestrator;
    private final IdentityGate identityGate;

    public ChatController(ChatTurnOrchestrator orchestrator, IdentityGate identityGate) {
        this.orchestrator = orchestrator;
        this.identityGate = identityGate;
    }

    @PostMapping(path = "/{sessionId}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ChatResponseDto send(@PathVariable("sessionId") String sessionId, @Valid @RequestBody ChatRequestDto request) {
        GenerationOptions options = orchestrator.resolveOptions(request.maxTokens(), request.temperature());
        TurnResult result = orchestrator.runTurn(identityGate.authenticate(), sessionId, request.message(), options);
        return new ChatResponseDto(
                result.sessionId(),
                MessageResponseDto.from(result.userMessage()),
                MessageResponseDto.from(result.assistantMessage()),
                result.usage()
        );
    }

    /**
     * Relays the reply as plain text while it is generated. Failures after the first byte are
     * reported in-band as a trailing {@code [ERROR: ...]} line.
     */
    @PostMapping(path = "/{sessionId}/stream", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public Flux<String> stream(@PathVariable("sessionId") String sessionId, @Valid @RequestBody ChatRequestDto request) {
        GenerationOptions options = orchestrator.resolveOptions(request.maxTokens(), request.temperature());
        return orchestrator.streamTurn(identityGate.authenticate(), sessionId, request.message(), options);
    }
}
