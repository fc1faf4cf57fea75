package com.williamcallahan.keycoordinator.web;

public record CompletionResponse(String status, String provider, String model, String text) implements ApiResponse {

    public static CompletionResponse success(String provider, String model, String text) {
        return new CompletionResponse(STATUS_SUCCESS, provider, model, text);
    }
}
