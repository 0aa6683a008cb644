/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.orgpolicy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One rule of an org policy. At most one of enforce, allow and deny may be set.
 */
@Builder(toBuilder = true)
@Jacksonized
@Value
public class PolicyRule {
    @JsonProperty("enforce")
    Boolean enforce;

    @JsonProperty("allow")
    RuleValues allow;

    @JsonProperty("deny")
    RuleValues deny;

    @JsonProperty("condition")
    RuleCondition condition;

    public static PolicyRule enforced(boolean enforce) {
        return PolicyRule.builder().enforce(enforce).build();
    }
}
