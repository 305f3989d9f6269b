package com.fhestream.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fhestream.checkpoint.CheckpointStore;
import com.fhestream.common.RetryPolicy;
import com.fhestream.common.Sleeper;
import com.fhestream.config.SchedulerConfig;
import com.fhestream.ingestion.handler.EventDispatcher;
import com.fhestream.ingestion.handler.IndexedEventHandler;
import com.fhestream.ingestion.indexer.LogsSubscriptionClient;
import com.fhestream.ingestion.indexer.ProgramIndexer;
import com.fhestream.ingestion.indexer.WebSocketLogsSubscriptionClient;
import com.fhestream.ingestion.logs.AnchorEventLogDecoder;
import com.fhestream.ingestion.normalizer.EventNormalizer;
import com.fhestream.ingestion.rpc.RateLimitedRpcExecutor;
import com.fhestream.ingestion.rpc.RpcTierClassifier;
import com.fhestream.ingestion.rpc.RpcTierPolicy;
import com.fhestream.ingestion.rpc.SolanaProgramRpc;
import com.fhestream.ingestion.rpc.SolanaRpcClient;
import com.fhestream.ingestion.rpc.WebClientSolanaRpcClient;
import com.fhestream.pubsub.EventPublisher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import java.time.Duration;
import java.util.List;

/**
 * Wires the indexer for the configured program: tier policy from the endpoint, rate-limited RPC, decoding,
 * handlers in @Order order.
 */
@Configuration
@EnableConfigurationProperties(IndexerProperties.class)
public class IndexerConfig {

    @Bean
    public RpcTierPolicy rpcTierPolicy(IndexerProperties properties) {
        return RpcTierClassifier.policyFor(properties.resolvedRpcEndpoint(), properties.getPollIntervalMs(), properties.getMaxPagesPerCycle());
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder, IndexerProperties properties) {
        return new WebClientSolanaRpcClient(webClientBuilder, Duration.ofMillis(properties.getRpcTimeoutMs()));
    }

    @Bean
    public SolanaProgramRpc solanaProgramRpc(SolanaRpcClient rpcClient, RpcTierPolicy policy, ObjectMapper objectMapper,
                                             IndexerProperties properties) {
        return new SolanaProgramRpc(rpcClient, new RateLimitedRpcExecutor(policy, Sleeper.THREAD), objectMapper,
                properties.resolvedRpcEndpoint(), properties.readCommitment());
    }

    @Bean
    public EventDispatcher eventDispatcher(List<IndexedEventHandler> handlers) {
        return new EventDispatcher(handlers);
    }

    @Bean
    public LogsSubscriptionClient logsSubscriptionClient(ObjectMapper objectMapper, IndexerProperties properties) {
        return new WebSocketLogsSubscriptionClient(new ReactorNettyWebSocketClient(), objectMapper, properties.resolvedWsEndpoint());
    }

    @Bean
    public ProgramIndexer programIndexer(IndexerProperties properties,
                                         SolanaProgramRpc rpc,
                                         RpcTierPolicy policy,
                                         CheckpointStore checkpointStore,
                                         EventDispatcher dispatcher,
                                         EventPublisher eventPublisher,
                                         @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler scheduler,
                                         LogsSubscriptionClient logsSubscriptionClient) {
        return new ProgramIndexer(
                properties.getProgramId(),
                rpc,
                policy,
                checkpointStore,
                new AnchorEventLogDecoder(properties.getProgramId()),
                new EventNormalizer(),
                dispatcher,
                eventPublisher,
                scheduler,
                logsSubscriptionClient,
                properties.getMode(),
                properties.getCommitment(),
                properties.getSignaturesPageSize(),
                Sleeper.THREAD,
                RetryPolicy.reconnectPolicy());
    }
}
