package com.alari.companion.inference;

import com.alari.companion.config.AlariProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.netty.channel.ChannelOption;
import io.netty.channel.ConnectTimeoutException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * HTTP client for the inference service. Stateless: neither call touches local storage.
 */
@Component
public class InferenceClient {

    private static final Logger log = LoggerFactory.getLogger(InferenceClient.class);

    static final String CHAT_PATH = "/inference/chat";
    static final String STREAM_PATH = "/inference/chat/stream";
    static final String API_KEY_HEADER = "X-API-Key";

    private final AlariProperties.Inference config;
    private final RestClient restClient;
    private final WebClient webClient;

    record InferenceRequest(
            List<InferenceMessage> messages,
            @JsonProperty("max_tokens") int maxTokens,
            double temperature
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InferenceResponse(String response, Map<String, Object> usage) {}

    @Autowired
    public InferenceClient(AlariProperties properties) {
        this(properties.inference());
    }

    InferenceClient(AlariProperties.Inference config) {
        this.config = config;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(config.connectTimeout());
        requestFactory.setReadTimeout(config.timeout());
        this.restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .baseUrl(config.baseUrl())
                .defaultHeaders(this::applyApiKey)
                .build();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, config.connectTimeout().toMillis()));
        this.webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(config.baseUrl())
                .defaultHeaders(this::applyApiKey)
                .build();

        log.info("Inference client configured: baseUrl='{}', timeout={}, connectTimeout={}, streamChunkTimeout={}",
                config.baseUrl(), config.timeout(), config.connectTimeout(), config.streamChunkTimeout());
    }

    /**
     * Sends the full history and waits for the whole reply.
     *
     * @throws UpstreamTimeoutException when no reply arrives within the configured timeout
     * @throws UpstreamUnavailableException when the service cannot be reached
     * @throws UpstreamProtocolException on a non-2xx status or an unusable body
     */
    public Completion complete(List<InferenceMessage> history, int maxTokens, double temperature) {
        InferenceResponse response;
        try {
            response = restClient.post()
                    .uri(CHAT_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(new InferenceRequest(history, maxTokens, temperature))
                    .retrieve()
                    .body(InferenceResponse.class);
        } catch (RestClientResponseException ex) {
            log.warn("Inference call rejected: status={}", ex.getStatusCode().value());
            throw new UpstreamProtocolException("Inference service error: " + ex.getStatusCode().value(), ex);
        } catch (ResourceAccessException ex) {
            throw classifyTransportFailure(ex);
        } catch (RestClientException ex) {
            log.warn("Inference response unreadable: {}", ex.getMessage());
            throw new UpstreamProtocolException("Inference service returned an unreadable response", ex);
        }
        if (response == null || response.response() == null) {
            throw new UpstreamProtocolException("Inference service response missing 'response' field");
        }
        return new Completion(response.response(), response.usage());
    }

    /**
     * Opens a streamed reply. The returned Flux is cold and issues the request on subscription;
     * subscribe once. Each text increment must arrive within the configured chunk timeout.
     */
    public Flux<String> streamComplete(List<InferenceMessage> history, int maxTokens, double temperature) {
        InferenceRequest request = new InferenceRequest(history, maxTokens, temperature);
        return Flux.defer(() -> {
            Utf8ChunkDecoder decoder = new Utf8ChunkDecoder();
            Flux<String> text = webClient.post()
                    .uri(STREAM_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_PLAIN, MediaType.ALL)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), response -> response.releaseBody()
                            .then(Mono.just(new UpstreamProtocolException("Inference service error: " + response.statusCode().value()))))
                    .bodyToFlux(DataBuffer.class)
                    .timeout(config.streamChunkTimeout())
                    .map(buffer -> decoder.decode(drain(buffer)));
            Mono<String> tail = Mono.defer(() -> decoder.hasPendingBytes()
                    ? Mono.error(new UpstreamProtocolException("Inference stream ended inside a multi-byte character"))
                    : Mono.empty());
            return text.concatWith(tail).filter(chunk -> !chunk.isEmpty());
        }).onErrorMap(ex -> !(ex instanceof InferenceException), this::classifyStreamFailure);
    }

    private void applyApiKey(HttpHeaders headers) {
        headers.set(API_KEY_HEADER, config.apiKey());
    }

    private InferenceException classifyTransportFailure(Exception ex) {
        if (hasCause(ex, SocketTimeoutException.class) || hasCause(ex, TimeoutException.class)
                || hasCause(ex, ConnectTimeoutException.class)) {
            log.warn("Inference call timed out: {}", ex.getMessage());
            return new UpstreamTimeoutException("Inference service timeout", ex);
        }
        log.warn("Inference service unreachable: {}", ex.getMessage());
        return new UpstreamUnavailableException("Cannot connect to inference service: " + rootMessage(ex), ex);
    }

    private Throwable classifyStreamFailure(Throwable ex) {
        if (ex instanceof TimeoutException) {
            log.warn("Inference stream stalled for longer than {}", config.streamChunkTimeout());
            return new UpstreamTimeoutException("Inference service timeout", ex);
        }
        if (ex instanceof WebClientRequestException requestException) {
            return classifyTransportFailure(requestException);
        }
        if (hasCause(ex, ConnectException.class) || hasCause(ex, UnknownHostException.class)) {
            return new UpstreamUnavailableException("Cannot connect to inference service: " + rootMessage(ex), ex);
        }
        log.warn("Inference stream failed: {}", ex.toString());
        return new UpstreamProtocolException("Inference stream failed: " + rootMessage(ex), ex);
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private static boolean hasCause(Throwable ex, Class<? extends Throwable> type) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static String rootMessage(Throwable ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
