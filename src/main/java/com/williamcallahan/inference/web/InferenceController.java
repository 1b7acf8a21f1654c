package com.williamcallahan.inference.web;

import com.williamcallahan.inference.client.InferenceRequest;
import com.williamcallahan.inference.client.ProviderCallException;
import com.williamcallahan.inference.domain.CapabilityRequirement;
import com.williamcallahan.inference.domain.ModelCapability;
import com.williamcallahan.inference.domain.errors.ApiResponse;
import com.williamcallahan.inference.service.AllProvidersFailedException;
import com.williamcallahan.inference.service.InferenceOrchestrator;
import java.util.EnumSet;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Generates text through the fallback orchestrator.
 */
@RestController
@RequestMapping("/api/inference")
public class InferenceController extends BaseController {

    private final InferenceOrchestrator orchestrator;

    public InferenceController(InferenceOrchestrator orchestrator, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.orchestrator = orchestrator;
    }

    /**
     * Runs one generation against the best available model.
     *
     * @param body prompt, optional image and capability requirement
     * @return generated text with the capability set that was requested
     */
    @PostMapping("/generate")
    public Mono<GenerateResponse> generate(@RequestBody GenerateBody body) {
        if (body == null || body.prompt() == null || body.prompt().isBlank()) {
            throw new IllegalArgumentException("prompt is required");
        }
        EnumSet<ModelCapability> required = EnumSet.noneOf(ModelCapability.class);
        if (body.capabilities() != null) {
            body.capabilities().forEach(name -> required.add(ModelCapability.fromName(name)));
        }
        InferenceRequest request;
        if (body.imageData() != null && !body.imageData().isBlank()) {
            required.add(ModelCapability.VISION);
            request = InferenceRequest.withImage(body.prompt(), body.imageData(), body.imageMimeType());
        } else {
            request = InferenceRequest.text(body.prompt());
        }
        int minContext = body.minContextLength() == null ? 0 : body.minContextLength();
        return orchestrator.generate(new CapabilityRequirement(required, minContext), request)
                .map(GenerateResponse::new);
    }

    @ExceptionHandler(AllProvidersFailedException.class)
    public ResponseEntity<ApiResponse> handleAllProvidersFailed(AllProvidersFailedException exception) {
        return exceptionBuilder.buildProviderFailureResponse(exception);
    }

    /**
     * Caller errors propagate from the orchestrator unchanged; report them as a bad request.
     */
    @ExceptionHandler(ProviderCallException.class)
    public ResponseEntity<ApiResponse> handleRejectedRequest(ProviderCallException exception) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Request rejected by provider", exception);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse> handleInvalidArgument(IllegalArgumentException exception) {
        return handleValidationException(exception);
    }

    /**
     * Generation request body.
     *
     * @param prompt prompt text
     * @param imageData optional base64 image
     * @param imageMimeType media type of the image
     * @param capabilities additional required capabilities
     * @param minContextLength minimum context window in tokens
     */
    public record GenerateBody(
            String prompt, String imageData, String imageMimeType, List<String> capabilities, Integer minContextLength) {}

    /**
     * Generation result.
     *
     * @param text generated text
     */
    public record GenerateResponse(String text) {}
}
