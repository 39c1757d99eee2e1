package com.example.tftlobby.evidence;

import com.example.tftlobby.fetch.FailureKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ExtractionResult {

    public enum Kind {
        EVIDENCE, EMPTY, FAILURE
    }

    public final Kind kind;
    public final List<EvidenceRecord> records;
    public final FailureKind failureKind;  // only for FAILURE
    public final String detail;            // reason for EMPTY / FAILURE, for logs

    private ExtractionResult(Kind kind, List<EvidenceRecord> records, FailureKind failureKind, String detail) {
        this.kind = kind;
        this.records = records;
        this.failureKind = failureKind;
        this.detail = detail;
    }

    /**
     * An empty record list is reported as {@link Kind#EMPTY}.
     */
    public static ExtractionResult evidence(List<EvidenceRecord> records) {
        if (records == null || records.isEmpty()) {
            return empty("no records");
        }
        return new ExtractionResult(Kind.EVIDENCE, Collections.unmodifiableList(new ArrayList<>(records)), null, null);
    }

    public static ExtractionResult empty(String reason) {
        return new ExtractionResult(Kind.EMPTY, Collections.emptyList(), null, reason);
    }

    public static ExtractionResult failure(FailureKind kind, String detail) {
        return new ExtractionResult(Kind.FAILURE, Collections.emptyList(), kind, detail);
    }

    public boolean hasEvidence() {
        return kind == Kind.EVIDENCE;
    }

    @Override
    public String toString() {
        switch (kind) {
            case EVIDENCE:
                return "EVIDENCE(" + records.size() + " records)";
            case FAILURE:
                return "FAILURE(" + failureKind + ": " + detail + ")";
            default:
                return "EMPTY(" + detail + ")";
        }
    }
}
