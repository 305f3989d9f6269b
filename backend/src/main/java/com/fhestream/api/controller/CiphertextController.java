package com.fhestream.api.controller;

import com.fhestream.api.dto.CiphertextResponse;
import com.fhestream.api.dto.RegisterCiphertextRequest;
import com.fhestream.api.dto.SubmitCiphertextRequest;
import com.fhestream.ciphertext.CiphertextNotFoundException;
import com.fhestream.ciphertext.CiphertextService;
import com.fhestream.domain.CiphertextRecord;
import com.fhestream.domain.Handle;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /ciphertexts (optimistic registration), POST /ciphertexts/{handle}/submit, GET /ciphertexts/{handle}.
 */
@RestController
@RequestMapping("/api/v1/ciphertexts")
@RequiredArgsConstructor
public class CiphertextController {

    private final CiphertextService ciphertextService;

    @PostMapping
    public ResponseEntity<CiphertextResponse> register(@Valid @RequestBody RegisterCiphertextRequest request) {
        CiphertextRecord record = ciphertextService.registerOptimistic(
                new Handle(request.handle()), request.owner(), request.clientTag());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(CiphertextResponse.from(record));
    }

    @PostMapping("/{handle}/submit")
    public ResponseEntity<CiphertextResponse> submit(@PathVariable String handle,
                                                     @Valid @RequestBody SubmitCiphertextRequest request) {
        CiphertextRecord record = ciphertextService.markSubmitting(new Handle(handle), request.txSignature());
        return ResponseEntity.ok(CiphertextResponse.from(record));
    }

    @GetMapping("/{handle}")
    public ResponseEntity<CiphertextResponse> get(@PathVariable String handle) {
        Handle parsed = new Handle(handle);
        return ciphertextService.find(parsed)
                .map(record -> ResponseEntity.ok(CiphertextResponse.from(record)))
                .orElseThrow(() -> new CiphertextNotFoundException(parsed.hex()));
    }
}
