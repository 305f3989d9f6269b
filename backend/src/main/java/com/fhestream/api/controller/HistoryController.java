package com.fhestream.api.controller;

import com.fhestream.api.dto.ErrorBody;
import com.fhestream.api.dto.LineageResponse;
import com.fhestream.api.dto.OperationHistoryResponse;
import com.fhestream.domain.Handle;
import com.fhestream.query.LineageNode;
import com.fhestream.query.OperationHistoryPage;
import com.fhestream.query.OperationHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operation history per caller and handle lineage.
 */
@RestController
@RequestMapping("/api/v1/history")
@RequiredArgsConstructor
public class HistoryController {

    private final OperationHistoryService operationHistoryService;

    @GetMapping
    public ResponseEntity<?> getHistory(
            @RequestParam(required = false) String caller,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        if (caller == null || caller.isBlank()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_CALLER", "caller is required"));
        }
        OperationHistoryPage page = operationHistoryService.findByCaller(caller, limit, offset);
        return ResponseEntity.ok(new OperationHistoryResponse(
                caller.trim(),
                page.items(),
                page.total(),
                page.limit(),
                page.offset(),
                page.hasMore()
        ));
    }

    @GetMapping("/lineage/{handle}")
    public ResponseEntity<?> getLineage(@PathVariable String handle) {
        Handle parsed;
        try {
            parsed = new Handle(handle);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_HANDLE", "Handle must be 32 bytes of hex"));
        }
        List<LineageNode> lineage = operationHistoryService.lineage(parsed.hex());
        if (lineage.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorBody.of("NOT_FOUND", "No indexed operation produced " + parsed.hex()));
        }
        return ResponseEntity.ok(new LineageResponse(parsed.hex(), lineage));
    }
}
