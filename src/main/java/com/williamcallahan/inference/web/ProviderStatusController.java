package com.williamcallahan.inference.web;

import com.williamcallahan.inference.domain.CapabilityRequirement;
import com.williamcallahan.inference.domain.ModelCandidate;
import com.williamcallahan.inference.domain.ModelCapability;
import com.williamcallahan.inference.domain.errors.ApiResponse;
import com.williamcallahan.inference.service.ErrorHistory;
import com.williamcallahan.inference.service.InferenceOrchestrator;
import com.williamcallahan.inference.service.ModelRegistry;
import com.williamcallahan.inference.service.ProviderHealthMonitor;
import com.williamcallahan.inference.service.ResponseCache;
import com.williamcallahan.inference.service.UnknownProviderException;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operations endpoints: provider statistics, health, error history, candidate ranking and admin resets.
 */
@RestController
@RequestMapping("/api/inference")
public class ProviderStatusController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(ProviderStatusController.class);

    private final InferenceOrchestrator orchestrator;
    private final ProviderHealthMonitor healthMonitor;
    private final ErrorHistory errorHistory;
    private final ModelRegistry modelRegistry;
    private final ResponseCache responseCache;

    public ProviderStatusController(
            InferenceOrchestrator orchestrator,
            ProviderHealthMonitor healthMonitor,
            ErrorHistory errorHistory,
            ModelRegistry modelRegistry,
            ResponseCache responseCache,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.orchestrator = orchestrator;
        this.healthMonitor = healthMonitor;
        this.errorHistory = errorHistory;
        this.modelRegistry = modelRegistry;
        this.responseCache = responseCache;
    }

    @GetMapping("/providers")
    public Map<String, InferenceOrchestrator.ProviderStats> providers() {
        return orchestrator.getProviderStats();
    }

    @GetMapping("/health")
    public Map<String, ProviderHealthMonitor.ProviderHealthReport> health() {
        return healthMonitor.getStatusReport();
    }

    @GetMapping("/errors")
    public ErrorReport errors() {
        return new ErrorReport(errorHistory.statistics(), errorHistory.recommendations(), responseCache.stats());
    }

    /**
     * Lists ranked candidates for a capability requirement.
     *
     * @param capabilities required capability names, any case, dashes allowed
     * @param minContext minimum context window in tokens
     * @return candidates best first
     */
    @GetMapping("/candidates")
    public List<CandidateView> candidates(
            @RequestParam(name = "capability", required = false) List<String> capabilities,
            @RequestParam(name = "minContext", defaultValue = "0") int minContext) {
        EnumSet<ModelCapability> required = EnumSet.noneOf(ModelCapability.class);
        if (capabilities != null) {
            capabilities.forEach(name -> required.add(ModelCapability.fromName(name)));
        }
        CapabilityRequirement requirement = new CapabilityRequirement(required, minContext);
        return modelRegistry.rankCandidates(requirement).stream().map(CandidateView::from).toList();
    }

    @PostMapping("/admin/providers/{name}/reset")
    public ResponseEntity<ApiResponse> resetProvider(@PathVariable("name") String name) {
        orchestrator.resetProvider(name);
        log.info("[{}] Provider reset via admin endpoint", name);
        return createSuccessResponse("Provider " + name + " reset");
    }

    @PostMapping("/admin/providers/reset")
    public ResponseEntity<ApiResponse> resetAllProviders() {
        orchestrator.resetAllProviders();
        return createSuccessResponse("All providers reset");
    }

    @PostMapping("/admin/cache/clear")
    public ResponseEntity<ApiResponse> clearCache() {
        responseCache.clear();
        return createSuccessResponse("Response cache cleared");
    }

    @ExceptionHandler(UnknownProviderException.class)
    public ResponseEntity<ApiResponse> handleUnknownProvider(UnknownProviderException exception) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, exception.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse> handleInvalidArgument(IllegalArgumentException exception) {
        return handleValidationException(exception);
    }

    /**
     * Candidate as exposed over HTTP.
     *
     * @param provider provider name
     * @param model model identifier
     * @param contextLength context window in tokens
     * @param capabilities declared capabilities
     * @param providerPriority provider rank
     * @param modelPriority model rank within the provider
     */
    public record CandidateView(
            String provider,
            String model,
            int contextLength,
            List<ModelCapability> capabilities,
            int providerPriority,
            int modelPriority) {

        static CandidateView from(ModelCandidate candidate) {
            return new CandidateView(
                    candidate.providerName(),
                    candidate.modelId(),
                    candidate.model().contextLength(),
                    candidate.model().capabilities().stream().sorted().toList(),
                    candidate.provider().priority(),
                    candidate.model().priority());
        }
    }

    /**
     * Error history summary with advice and cache counters.
     */
    public record ErrorReport(
            ErrorHistory.ErrorStatistics statistics,
            Map<String, String> recommendations,
            ResponseCache.CacheStats cache) {}
}
