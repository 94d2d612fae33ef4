package io.repoinsight.learning;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything learned about one {@link PatternSignature}: its detection history,
 * human corrections and lifecycle.
 * <p>
 * Mutable; only {@link PatternStore} mutates records it owns. Records handed out by the store
 * are copies.
 */
public class PatternRecord {

    private String id;
    private PatternSignature signature;
    private String signatureHash;
    private PatternContext context = PatternContext.empty();
    private PatternPerformance performance = new PatternPerformance();
    private List<Correction> corrections = new ArrayList<>();
    private PatternLifecycle lifecycle = new PatternLifecycle();
    private String suggestedFix;
    private String notes;

    public static PatternRecord create(PatternSignature signature, PatternContext context, Instant now) {
        PatternRecord record = new PatternRecord();
        record.id = signature.patternId();
        record.signature = signature;
        record.signatureHash = signature.signatureHash();
        record.context = context != null ? context : PatternContext.empty();
        record.lifecycle = PatternLifecycle.createdAt(now);
        return record;
    }

    public PatternRecord copy() {
        PatternRecord copy = new PatternRecord();
        copy.id = id;
        copy.signature = signature;
        copy.signatureHash = signatureHash;
        copy.context = context;
        copy.performance = performance.copy();
        copy.corrections = new ArrayList<>(corrections);
        copy.lifecycle = lifecycle.copy();
        copy.suggestedFix = suggestedFix;
        copy.notes = notes;
        return copy;
    }

    /**
     * True when findings of this pattern should be suppressed.
     */
    @JsonIgnore
    public boolean isSuppressed() {
        return lifecycle.isSkipInFuture();
    }

    @JsonIgnore
    public String detectorId() {
        return signature.detectorId();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public PatternSignature getSignature() {
        return signature;
    }

    public void setSignature(PatternSignature signature) {
        this.signature = signature;
    }

    public String getSignatureHash() {
        return signatureHash;
    }

    public void setSignatureHash(String signatureHash) {
        this.signatureHash = signatureHash;
    }

    public PatternContext getContext() {
        return context;
    }

    public void setContext(PatternContext context) {
        this.context = context != null ? context : PatternContext.empty();
    }

    public PatternPerformance getPerformance() {
        return performance;
    }

    public void setPerformance(PatternPerformance performance) {
        this.performance = performance != null ? performance : new PatternPerformance();
    }

    public List<Correction> getCorrections() {
        return corrections;
    }

    public void setCorrections(List<Correction> corrections) {
        this.corrections = corrections != null ? new ArrayList<>(corrections) : new ArrayList<>();
    }

    public PatternLifecycle getLifecycle() {
        return lifecycle;
    }

    public void setLifecycle(PatternLifecycle lifecycle) {
        this.lifecycle = lifecycle != null ? lifecycle : new PatternLifecycle();
    }

    public String getSuggestedFix() {
        return suggestedFix;
    }

    public void setSuggestedFix(String suggestedFix) {
        this.suggestedFix = suggestedFix;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
