package com.williamcallahan.inference.service;

import com.williamcallahan.inference.domain.failure.CandidateFailure;
import com.williamcallahan.inference.domain.failure.ErrorKind;
import com.williamcallahan.inference.domain.failure.RecoveryPolicy;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Terminal failure of a fallback run: every candidate was attempted or skipped without a result.
 */
public class AllProvidersFailedException extends RuntimeException {

    private final String operationName;
    private final List<CandidateFailure> failures;
    private final ErrorKind dominantKind;
    private final Duration retryAfter;

    public AllProvidersFailedException(
            String operationName, List<CandidateFailure> failures, ErrorKind dominantKind, Duration retryAfter) {
        super(buildMessage(operationName, failures, dominantKind, retryAfter));
        this.operationName = operationName;
        this.failures = List.copyOf(failures);
        this.dominantKind = Objects.requireNonNull(dominantKind, "dominantKind");
        this.retryAfter = Objects.requireNonNull(retryAfter, "retryAfter");
    }

    private static String buildMessage(
            String operationName, List<CandidateFailure> failures, ErrorKind dominantKind, Duration retryAfter) {
        return "All providers failed for " + operationName + " (dominant=" + dominantKind
                + ", candidates=" + failures.size() + ", retryAfter=" + retryAfter.getSeconds() + "s)";
    }

    public String operationName() {
        return operationName;
    }

    /** Returns per-candidate outcomes in the order they were considered. */
    public List<CandidateFailure> failures() {
        return failures;
    }

    public ErrorKind dominantKind() {
        return dominantKind;
    }

    public RecoveryPolicy policy() {
        return dominantKind.policy();
    }

    /** Suggested wait before the caller retries the whole operation. */
    public Duration retryAfter() {
        return retryAfter;
    }
}
