package com.ownmyhealth.phi.service;

/**
 * Outcome of a refresh-token rotation. {@code demo} lets the caller keep the
 * longer demo cookie lifetime.
 */
public record RefreshResult(AuthTokens tokens, boolean demo) {
}
