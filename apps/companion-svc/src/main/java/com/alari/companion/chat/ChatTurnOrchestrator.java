package com.alari.companion.chat;

import com.alari.companion.config.AlariProperties;
import com.alari.companion.conversation.ConversationEntity;
import com.alari.companion.conversation.ConversationService;
import com.alari.companion.conversation.ConversationStore;
import com.alari.companion.conversation.MessageEntity;
import com.alari.companion.conversation.MessageRole;
import com.alari.companion.inference.Completion;
import com.alari.companion.inference.InferenceClient;
import com.alari.companion.inference.InferenceException;
import com.alari.companion.inference.InferenceMessage;
import com.alari.companion.security.Identity;
import com.alari.companion.security.RequestContextHolder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * Runs one chat turn against a stored conversation.
 *
 * <p>Buffered turns write nothing unless the inference call succeeds, and then write the user
 * utterance and the reply together. Streamed turns store the user utterance up front, relay the
 * reply as it arrives and store it once the stream ends. A failed stream gets a single in-band
 * error marker and no reply row. A stream the caller abandons keeps whatever text had arrived.
 */
@Service
public class ChatTurnOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ChatTurnOrchestrator.class);

    static final String ERROR_MARKER_FORMAT = "\n[ERROR: %s]";

    private final ConversationService conversationService;
    private final ConversationStore store;
    private final InferenceClient inferenceClient;
    private final GenerationOptions defaults;

    public ChatTurnOrchestrator(ConversationService conversationService,
                                ConversationStore store,
                                InferenceClient inferenceClient,
                                AlariProperties properties) {
        this.conversationService = conversationService;
        this.store = store;
        this.inferenceClient = inferenceClient;
        this.defaults = new GenerationOptions(properties.chat().defaultMaxTokens(), properties.chat().defaultTemperature());
    }

    public GenerationOptions resolveOptions(Integer maxTokens, Double temperature) {
        return GenerationOptions.of(maxTokens, temperature, defaults);
    }

    public TurnResult runTurn(Identity identity, String sessionId, String message, GenerationOptions options) {
        requireText(message);
        ConversationEntity conversation = conversationService.authorize(identity, sessionId);

        List<InferenceMessage> history = toHistory(store.listMessages(conversation.getId()));
        history.add(new InferenceMessage(MessageRole.USER.value(), message));

        Completion completion;
        try {
            completion = inferenceClient.complete(history, options.maxTokens(), options.temperature());
        } catch (InferenceException ex) {
            log.warn("Chat turn failed before any write: conversation={} traceId={} error={}",
                    sessionId, RequestContextHolder.currentTraceId(), ex.getMessage());
            throw ex;
        }

        ConversationStore.MessagePair pair = store.appendMessagePair(conversation.getId(), message, completion.text());
        log.info("Chat turn stored: conversation={} historySize={} replyChars={}",
                sessionId, history.size(), completion.text().length());
        return new TurnResult(conversation.getSessionId(), pair.user(), pair.assistant(), completion.usage());
    }

    /**
     * Starts a streamed turn. Authorization and the user-message write happen before this method
     * returns; the reply is produced when the returned Flux is subscribed.
     */
    public Flux<String> streamTurn(Identity identity, String sessionId, String message, GenerationOptions options) {
        requireText(message);
        ConversationEntity conversation = conversationService.authorize(identity, sessionId);
        Long conversationId = conversation.getId();
        String traceId = RequestContextHolder.currentTraceId();

        store.appendMessage(conversationId, MessageRole.USER, message);
        List<InferenceMessage> history = toHistory(store.listMessages(conversationId));

        // cancellation can arrive on a different thread than the chunks
        StringBuffer accumulated = new StringBuffer();
        AtomicBoolean settled = new AtomicBoolean(false);

        Flux<String> persistReply = Flux.<String>defer(() -> {
            if (settled.compareAndSet(false, true)) {
                persistAssistant(conversationId, sessionId, accumulated.toString(), traceId, "completed");
            }
            return Flux.empty();
        }).subscribeOn(Schedulers.boundedElastic());

        return inferenceClient.streamComplete(history, options.maxTokens(), options.temperature())
                .doOnNext(accumulated::append)
                .concatWith(persistReply)
                .onErrorResume(ex -> {
                    settled.set(true);
                    log.warn("Chat stream failed: conversation={} traceId={} charsRelayed={} error={}",
                            sessionId, traceId, accumulated.length(), ex.getMessage());
                    return Flux.just(errorMarker(ex));
                })
                .doOnCancel(() -> {
                    if (settled.compareAndSet(false, true)) {
                        Schedulers.boundedElastic().schedule(() ->
                                persistPartial(conversationId, sessionId, accumulated.toString(), traceId));
                    }
                });
    }

    private void persistAssistant(Long conversationId, String sessionId, String text, String traceId, String outcome) {
        if (text.isEmpty()) {
            log.info("Chat stream {} with no text, nothing stored: conversation={} traceId={}", outcome, sessionId, traceId);
            return;
        }
        store.appendMessage(conversationId, MessageRole.ASSISTANT, text);
        log.info("Chat stream {}: conversation={} traceId={} replyChars={}", outcome, sessionId, traceId, text.length());
    }

    private void persistPartial(Long conversationId, String sessionId, String text, String traceId) {
        try {
            persistAssistant(conversationId, sessionId, text, traceId, "cancelled");
        } catch (RuntimeException ex) {
            // the caller is gone; nobody left to report to
            log.error("Failed to store partial reply: conversation={} traceId={}", sessionId, traceId, ex);
        }
    }

    static String errorMarker(Throwable ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return String.format(ERROR_MARKER_FORMAT, message);
    }

    private static List<InferenceMessage> toHistory(List<MessageEntity> messages) {
        List<InferenceMessage> history = new ArrayList<>(messages.size() + 1);
        for (MessageEntity message : messages) {
            history.add(new InferenceMessage(message.getRole().value(), message.getContent()));
        }
        return history;
    }

    private static void requireText(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
    }
}
