package com.fhestream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fhestream.checkpoint.InMemoryCheckpointStore;
import com.fhestream.common.Base58;
import com.fhestream.common.RetryPolicy;
import com.fhestream.domain.BinaryOperator;
import com.fhestream.domain.Handle;
import com.fhestream.domain.HandleDerivation;
import com.fhestream.domain.message.EventTypes;
import com.fhestream.domain.message.PubSubMessage;
import com.fhestream.gateway.GatewayProperties;
import com.fhestream.gateway.StreamChannel;
import com.fhestream.gateway.StreamFrame;
import com.fhestream.gateway.StreamRequest;
import com.fhestream.gateway.StreamingGateway;
import com.fhestream.history.InMemoryEventHistoryStore;
import com.fhestream.ingestion.config.IndexerMode;
import com.fhestream.ingestion.handler.EventDispatcher;
import com.fhestream.ingestion.handler.PublishingEventHandler;
import com.fhestream.ingestion.indexer.ProgramIndexer;
import com.fhestream.ingestion.logs.AnchorEventLogDecoder;
import com.fhestream.ingestion.normalizer.EventNormalizer;
import com.fhestream.ingestion.rpc.MockSolanaRpcClient;
import com.fhestream.ingestion.rpc.RateLimitedRpcExecutor;
import com.fhestream.ingestion.rpc.RpcTierPolicy;
import com.fhestream.ingestion.rpc.SolanaProgramRpc;
import com.fhestream.pubsub.EventPublisher;
import com.fhestream.pubsub.InMemoryPublishBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static com.fhestream.ingestion.logs.ProgramLogs.binaryOp;
import static com.fhestream.ingestion.logs.ProgramLogs.filled;
import static com.fhestream.ingestion.logs.ProgramLogs.invocation;
import static com.fhestream.ingestion.logs.ProgramLogs.registration;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Chain to subscriber: the indexer reads a registration and an ADD from the node, the publisher fans them out,
 * and the gateway streams them to the caller live and again on resume.
 */
class EndToEndFlowTest {

    private static final String PROGRAM_ID = "FkLGYGk2bypUXgpGmcsCTmKZo6LCjHaXswbhY1LNGAKj";
    private static final byte[] CALLER = filled(32, 9);
    private static final String PRINCIPAL = Base58.encode(CALLER);
    private static final Handle LHS = Handle.of(filled(32, 1));
    private static final Handle RHS = Handle.of(filled(32, 2));

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private MockSolanaRpcClient node;
    private InMemoryEventHistoryStore history;
    private StreamingGateway gateway;
    private ProgramIndexer indexer;

    @BeforeEach
    void setUp() {
        node = new MockSolanaRpcClient();
        node.setSlot(500);
        InMemoryPublishBus bus = new InMemoryPublishBus();
        history = new InMemoryEventHistoryStore(objectMapper);
        EventPublisher publisher = new EventPublisher(bus, history, Clock.systemUTC());
        gateway = new StreamingGateway(bus, history, objectMapper, new GatewayProperties(), Clock.systemUTC());

        InMemoryCheckpointStore checkpoints = new InMemoryCheckpointStore();
        checkpoints.seed(PROGRAM_ID, 300, "seed");
        RpcTierPolicy policy = RpcTierPolicy.LOCAL;
        SolanaProgramRpc rpc = new SolanaProgramRpc(node, new RateLimitedRpcExecutor(policy, millis -> { }), objectMapper,
                "http://127.0.0.1:8899", "confirmed");
        indexer = new ProgramIndexer(PROGRAM_ID, rpc, policy, checkpoints, new AnchorEventLogDecoder(PROGRAM_ID),
                new EventNormalizer(), new EventDispatcher(List.of(new PublishingEventHandler(publisher))), publisher,
                mock(TaskScheduler.class), null, IndexerMode.POLLING, "confirmed", 1000, millis -> { },
                RetryPolicy.reconnectPolicy());
        indexer.start();

        Handle sum = HandleDerivation.derive(BinaryOperator.ADD, List.of(LHS, RHS), PROGRAM_ID);
        node.addTransaction("sig-register", 401, 1_700_000_401L, PRINCIPAL,
                invocation(PROGRAM_ID, registration(CALLER, LHS.bytes(), filled(32, 0))));
        node.addTransaction("sig-add", 402, 1_700_000_402L, PRINCIPAL,
                invocation(PROGRAM_ID, binaryOp(CALLER, BinaryOperator.ADD.code(), LHS.bytes(), RHS.bytes(), sum.bytes())));
    }

    @Test
    @DisplayName("the caller's stream receives ciphertext.confirmed then operation.completed")
    void indexedEvents_reachTheCallersStream() {
        StepVerifier.create(gateway.open(new StreamRequest(StreamChannel.USER, PRINCIPAL, null, null)))
                .expectNextMatches(frame -> frame.kind() == StreamFrame.Kind.CONNECTED)
                .then(() -> assertThat(indexer.pollOnce()).isEqualTo(2))
                .assertNext(frame -> {
                    assertThat(frame.kind()).isEqualTo(StreamFrame.Kind.EVENT);
                    assertThat(frame.data()).contains(EventTypes.CIPHERTEXT_CONFIRMED, LHS.hex(), "sig-register");
                })
                .assertNext(frame -> assertThat(frame.data()).contains(EventTypes.OPERATION_COMPLETED, "\"operation\":\"ADD\""))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
        indexer.stop();
    }

    @Test
    @DisplayName("a subscriber resuming from the first event replays only what it missed")
    void resume_replaysMissedEvents() {
        indexer.pollOnce();
        indexer.stop();
        List<PubSubMessage> forCaller = history.all().stream()
                .filter(m -> m.eventType().startsWith("user."))
                .toList();
        assertThat(forCaller).extracting(PubSubMessage::eventType)
                .containsExactly(EventTypes.CIPHERTEXT_CONFIRMED, EventTypes.OPERATION_COMPLETED);

        StepVerifier.create(gateway.open(new StreamRequest(StreamChannel.USER, PRINCIPAL, forCaller.get(0).eventId(), null)))
                .expectNextMatches(frame -> frame.kind() == StreamFrame.Kind.CONNECTED)
                .assertNext(frame -> assertThat(frame.eventId()).isEqualTo(forCaller.get(1).eventId()))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void globalStream_receivesIndexerEvents() {
        StepVerifier.create(gateway.open(new StreamRequest(StreamChannel.GLOBAL, null, null, null)))
                .expectNextMatches(frame -> frame.kind() == StreamFrame.Kind.CONNECTED)
                .then(indexer::pollOnce)
                .assertNext(frame -> assertThat(frame.data()).contains("indexer.InputHandleRegistered"))
                .assertNext(frame -> assertThat(frame.data()).contains("indexer.BinaryOpRequested"))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
        indexer.stop();
    }
}
