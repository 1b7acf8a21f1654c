package com.williamcallahan.inference.service;

import com.williamcallahan.inference.domain.ModelCandidate;
import java.util.Map;

/**
 * Performs the upstream call for one candidate during a fallback run.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface CandidateRequest<T> {

    /**
     * Calls the candidate's provider.
     *
     * @param candidate provider and model to call
     * @param credentialIndex index of the provider credential to authenticate with
     * @param arguments caller-supplied call arguments
     * @return the result, never null
     * @throws Exception any upstream failure; it is classified by the orchestrator
     */
    T call(ModelCandidate candidate, int credentialIndex, Map<String, Object> arguments) throws Exception;
}
