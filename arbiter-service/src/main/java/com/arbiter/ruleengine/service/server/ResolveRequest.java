/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.service.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Body of {@code POST /resolve}.
 *
 * @param facts the applicant's facts; non-scalar values are ignored
 * @param rules optional rule list replacing the managed rules for this request
 * @param trace whether to include the per-condition trace
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResolveRequest(
        @JsonProperty("facts") Map<String, Object> facts,
        @JsonProperty("rules") JsonNode rules,
        @JsonProperty("trace") boolean trace) {

    public boolean hasRules() {
        return rules != null && !rules.isNull() && !rules.isMissingNode();
    }
}
