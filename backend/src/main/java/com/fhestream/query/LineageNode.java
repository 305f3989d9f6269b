package com.fhestream.query;

import java.util.List;

/**
 * How one handle was produced.
 */
public record LineageNode(String handle, String operation, String operationType, List<String> inputHandles,
                          String signature, long slot) {
}
