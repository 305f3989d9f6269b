package com.fhestream.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

/**
 * Lineage edge: which inputs and operator produced a handle.
 */
@Document(collection = "handle_dependencies")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class HandleDependency {

    @Id
    @EqualsAndHashCode.Include
    private String outputHandle;
    private List<String> inputHandles;
    private String operation;
    private OperationType operationType;
    private String signature;
    private long slot;
}
