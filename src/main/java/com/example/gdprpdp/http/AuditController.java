package com.example.gdprpdp.http;

import com.example.gdprpdp.models.AuditEntry;
import com.example.gdprpdp.service.AuditLogService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * Read-only access to the audit chain: range reads, a JSON-lines export and chain verification.
 */
@RestController
public class AuditController {

    static final MediaType JSON_LINES = MediaType.parseMediaType("application/x-ndjson");

    private final AuditLogService auditLogService;
    private final ObjectMapper objectMapper;

    public AuditController(AuditLogService auditLogService, ObjectMapper objectMapper) {
        this.auditLogService = auditLogService;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/audit/entries")
    public ResponseEntity<List<AuditEntry>> entries(
            @RequestParam(name = "from", defaultValue = "0") long from,
            @RequestParam(name = "to", required = false) Long to) {
        return ResponseEntity.ok(auditLogService.read(from, to == null ? Long.MAX_VALUE : to));
    }

    /**
     * One entry per line. Payloads are the stored canonical strings, so each line can be
     * re-hashed offline.
     */
    @GetMapping("/audit/entries.jsonl")
    public ResponseEntity<StreamingResponseBody> export() {
        StreamingResponseBody body = out -> {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            try {
                auditLogService.forEachEntry(entry -> writeLine(writer, entry));
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
            writer.flush();
        };
        return ResponseEntity.ok().contentType(JSON_LINES).body(body);
    }

    @GetMapping("/audit/verify")
    public ResponseEntity<ChainVerificationResponse> verify() {
        return ResponseEntity.ok(ChainVerificationResponse.from(auditLogService.verify()));
    }

    private void writeLine(Writer writer, AuditEntry entry) {
        try {
            writer.write(objectMapper.writeValueAsString(entry));
            writer.write('\n');
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
