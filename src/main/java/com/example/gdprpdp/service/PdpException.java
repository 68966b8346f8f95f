package com.example.gdprpdp.service;

import java.util.List;
import lombok.Getter;

public class PdpException extends RuntimeException {

    public enum Code {
        SCHEMA_INVALID,
        POLICY_NOT_FOUND,
        POLICY_ALREADY_EXISTS,
        CHAIN_VERIFICATION_FAILED,
        DUTY_EXECUTION_FAILED,
        CONCURRENT_WRITE_CONFLICT,
        INVALID_REQUEST
    }

    @Getter
    private final Code code;

    @Getter
    private final List<String> violations;

    private PdpException(Code code, String message, List<String> violations, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    private PdpException(Code code, String message) {
        this(code, message, null, null);
    }

    public static PdpException schemaInvalid(List<String> violations) {
        return new PdpException(Code.SCHEMA_INVALID,
                "Policy definition rejected: " + String.join("; ", violations), violations, null);
    }

    public static PdpException policyNotFound(String policyId) {
        return new PdpException(Code.POLICY_NOT_FOUND,
                "Policy " + policyId + " does not exist");
    }

    public static PdpException policyAlreadyExists(String policyId) {
        return new PdpException(Code.POLICY_ALREADY_EXISTS,
                "Policy " + policyId + " already exists");
    }

    public static PdpException chainVerificationFailed(long firstBadIndex) {
        return new PdpException(Code.CHAIN_VERIFICATION_FAILED,
                "Audit chain verification failed at sequence " + firstBadIndex);
    }

    public static PdpException dutyExecutionFailed(String dutyId, Throwable cause) {
        return new PdpException(Code.DUTY_EXECUTION_FAILED,
                "Deletion hook failed for duty " + dutyId + ": " + describe(cause), null, cause);
    }

    public static PdpException concurrentWriteConflict(String logId, long sequence, Throwable cause) {
        return new PdpException(Code.CONCURRENT_WRITE_CONFLICT,
                "Audit log " + logId + " already has an entry at sequence " + sequence
                        + "; another writer is active", null, cause);
    }

    public static PdpException writerHalted(String logId) {
        return new PdpException(Code.CONCURRENT_WRITE_CONFLICT,
                "Audit log " + logId + " writer halted after a write conflict");
    }

    public static PdpException invalidRequest(String message) {
        return new PdpException(Code.INVALID_REQUEST, message);
    }

    static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }
}
