package com.fhestream.api.dto;

import com.fhestream.query.LineageNode;

import java.util.List;

/**
 * Producing operation of a handle first, then those of its inputs.
 */
public record LineageResponse(String handle, List<LineageNode> lineage) {
}
