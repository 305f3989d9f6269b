package com.fhestream.ingestion.indexer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * logsSubscribe over the node's JSON-RPC WebSocket. Sends the subscribe request on open and maps each
 * logsNotification to a {@link LogsNotification}.
 */
@Slf4j
public class WebSocketLogsSubscriptionClient implements LogsSubscriptionClient {

    private final WebSocketClient webSocketClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;

    public WebSocketLogsSubscriptionClient(WebSocketClient webSocketClient, ObjectMapper objectMapper, String endpoint) {
        this.webSocketClient = webSocketClient;
        this.objectMapper = objectMapper;
        this.endpoint = URI.create(endpoint);
    }

    @Override
    public Flux<LogsNotification> subscribe(String programId, String commitment, Runnable onSubscribed) {
        return Flux.defer(() -> {
            Sinks.Many<LogsNotification> sink = Sinks.many().unicast().onBackpressureBuffer();
            Mono<Void> session = webSocketClient.execute(endpoint, ws -> {
                String request = subscribeRequest(programId, commitment);
                Mono<Void> send = ws.send(Mono.just(ws.textMessage(request)));
                Mono<Void> receive = ws.receive()
                        .map(WebSocketMessage::getPayloadAsText)
                        .doOnNext(text -> handleMessage(text, sink, onSubscribed))
                        .then();
                return send.then(receive);
            });
            return sink.asFlux().mergeWith(session
                    .then(Mono.<LogsNotification>error(new IllegalStateException("logs subscription closed by " + endpoint))));
        });
    }

    private void handleMessage(String text, Sinks.Many<LogsNotification> sink, Runnable onSubscribed) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unparsable WebSocket message from {}", endpoint);
            return;
        }
        if (root.has("error")) {
            sink.tryEmitError(new IllegalStateException("logsSubscribe rejected: " + root.get("error")));
            return;
        }
        if (root.has("result") && root.has("id")) {
            log.info("Logs subscription {} established on {}", root.get("result").asText(), endpoint);
            onSubscribed.run();
            return;
        }
        if (!"logsNotification".equals(root.path("method").asText())) {
            return;
        }
        JsonNode result = root.path("params").path("result");
        JsonNode value = result.path("value");
        JsonNode err = value.path("err");
        sink.tryEmitNext(new LogsNotification(
                value.path("signature").asText(),
                result.path("context").path("slot").asLong(),
                !err.isMissingNode() && !err.isNull()));
    }

    private String subscribeRequest(String programId, String commitment) {
        Map<String, Object> request = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", "logsSubscribe",
                "params", List.of(Map.of("mentions", List.of(programId)), Map.of("commitment", commitment)));
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot build logsSubscribe request", e);
        }
    }
}
