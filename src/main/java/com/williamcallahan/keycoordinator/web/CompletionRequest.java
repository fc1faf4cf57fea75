package com.williamcallahan.keycoordinator.web;

/**
 * Body of a coordinated completion request.
 *
 * @param prompt user prompt
 * @param provider provider name; defaults to cerebras when absent
 */
public record CompletionRequest(String prompt, String provider) {}
