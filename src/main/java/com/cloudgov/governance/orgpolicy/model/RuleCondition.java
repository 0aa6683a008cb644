/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.orgpolicy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Condition guarding a rule. Preserved as given, never evaluated.
 */
@Builder(toBuilder = true)
@Jacksonized
@Value
public class RuleCondition {
    @JsonProperty("expression")
    String expression;

    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @JsonProperty("location")
    String location;
}
