package com.landingzone.orchestrator.storage.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of POST .../rewriteTo/...; large objects need several calls,
 * each passing back the previous rewriteToken until done is true.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RewriteResponse(boolean done, String rewriteToken) {}
