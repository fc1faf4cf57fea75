package com.williamcallahan.keycoordinator.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.service.CoordinatedCompletionService;
import com.williamcallahan.keycoordinator.service.CoordinatedSearchService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Budget-gated, credential-coordinated LLM completion and web search endpoints.
 */
@RestController
@RequestMapping("/api/research")
public class ResearchController {

    static final String CLIENT_ID_HEADER = "X-Client-Id";

    private final CoordinatedCompletionService completionService;
    private final CoordinatedSearchService searchService;

    public ResearchController(CoordinatedCompletionService completionService, CoordinatedSearchService searchService) {
        this.completionService = completionService;
        this.searchService = searchService;
    }

    @PostMapping("/complete")
    public CompletionResponse complete(
            @RequestBody CompletionRequest request,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientId,
            HttpServletRequest servletRequest) {
        ApiProvider provider = request.provider() == null || request.provider().isBlank()
                ? ApiProvider.CEREBRAS
                : ApiProvider.fromName(request.provider());
        CoordinatedCompletionService.CompletionResult result =
                completionService.complete(provider, request.prompt(), resolveClientId(clientId, servletRequest));
        return CompletionResponse.success(result.provider(), result.model(), result.text());
    }

    @PostMapping("/search")
    public JsonNode search(
            @RequestBody SearchRequest request,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientId,
            HttpServletRequest servletRequest) {
        return searchService.search(request.query(), request.maxResults(), resolveClientId(clientId, servletRequest));
    }

    private static String resolveClientId(String clientId, HttpServletRequest servletRequest) {
        if (clientId != null && !clientId.isBlank()) {
            return clientId.trim();
        }
        String remoteAddress = servletRequest.getRemoteAddr();
        return remoteAddress == null || remoteAddress.isBlank() ? "anonymous" : remoteAddress;
    }
}
