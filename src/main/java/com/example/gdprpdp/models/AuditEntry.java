package com.example.gdprpdp.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * One link of the append-only audit chain. {@code hash} covers the previous entry's hash and this
 * entry's canonical fields, so every entry can be re-verified from its own fields plus its
 * predecessor's hash.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class AuditEntry {

    public static final String GENESIS_HASH = "0".repeat(64);

    // Required fields: Lombok @NonNull enforces runtime null checks in builder
    @NonNull
    @JsonProperty("log_id")
    private String logId;        // PK

    @NonNull
    @JsonProperty("sequence")
    private Long sequence;       // SK, gapless from 0

    @NonNull
    @JsonProperty("timestamp")
    private Long timestamp;

    @NonNull
    @JsonProperty("kind")
    private Kind kind;

    @NonNull
    @JsonProperty("payload")
    private String payload;      // canonical JSON, hashed as stored

    @NonNull
    @JsonProperty("prev_hash")
    private String prevHash;

    // no @NonNull here, the builder will fill it automatically
    @JsonProperty("hash")
    private String hash;

    // ----- DynamoDB annotations on getters -----
    @DynamoDbPartitionKey
    @DynamoDbAttribute("log_id")
    public String getLogId() { return logId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("sequence")
    public Long getSequence() { return sequence; }

    @DynamoDbAttribute("timestamp")
    public Long getTimestamp() { return timestamp; }

    @DynamoDbAttribute("kind")
    public Kind getKind() { return kind; }

    @DynamoDbAttribute("payload")
    public String getPayload() { return payload; }

    @DynamoDbAttribute("prev_hash")
    public String getPrevHash() { return prevHash; }

    @DynamoDbAttribute("hash")
    public String getHash() { return hash; }

    public enum Kind {
        DECISION("Decision"),
        DELETE("Delete");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }

        @JsonCreator
        public static Kind fromString(String v) {
            for (Kind k : values()) {
                if (k.label.equals(v) || k.name().equals(v)) {
                    return k;
                }
            }
            throw new IllegalArgumentException("Unknown AuditEntry.Kind: " + v);
        }
    }

    /**
     * {@code sequence|timestamp|kind|payload}. The log id is deliberately absent: an entry's hash
     * does not change if the log is exported and re-imported under another id.
     */
    public static String canonicalForm(AuditEntry e) {
        return String.join("|",
                e.sequence == null ? "" : String.valueOf(e.sequence),
                e.timestamp == null ? "" : String.valueOf(e.timestamp),
                e.kind == null ? "" : e.kind.label(),
                nn(e.payload)
        );
    }

    // hash chain helpers
    public static String computeHash(AuditEntry e) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest((nn(e.prevHash) + canonicalForm(e)).getBytes(StandardCharsets.UTF_8));
            return bytesToHex(digest);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    public boolean hashMatches() {
        return hash != null && hash.equals(computeHash(this));
    }

    private static String nn(String s) { return s == null ? "" : s; }

    private static String bytesToHex(byte[] bytes) {
        final char[] HEX = "0123456789abcdef".toCharArray();
        char[] out = new char[bytes.length * 2];
        for (int i = 0, j = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0F];
        }
        return new String(out);
    }

    public static class AuditEntryBuilder {
        public AuditEntry build() {
            AuditEntry e = new AuditEntry(logId, sequence, timestamp, kind, payload, prevHash, null);
            e.hash = computeHash(e);
            return e;
        }
    }
}
