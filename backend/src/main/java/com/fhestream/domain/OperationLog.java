package com.fhestream.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * One confirmed operation request. Keyed by result handle: the same handle is always the same operation.
 */
@Document(collection = "operation_log")
@CompoundIndex(name = "caller_slot", def = "{'caller': 1, 'slot': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class OperationLog {

    /** Result handle hex. */
    @Id
    @EqualsAndHashCode.Include
    private String resultHandle;
    private String caller;
    private OperationType operationType;
    private String operation;
    private List<String> inputHandles;
    @Indexed
    private String signature;
    private long slot;
    private Long blockTime;
    private Instant indexedAt;
}
