package com.williamcallahan.keycoordinator.web;

/**
 * Body of a coordinated search request.
 *
 * @param query search query
 * @param maxResults requested result count, optional
 */
public record SearchRequest(String query, Integer maxResults) {}
