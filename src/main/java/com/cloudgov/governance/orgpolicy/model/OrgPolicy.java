/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.orgpolicy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;

/**
 * Organization policy for one constraint. Rules are kept in declaration order; the platform evaluates them in order
 * and the first rule whose condition matches wins.
 */
@Builder(toBuilder = true)
@Jacksonized
@Value
public class OrgPolicy {
    @JsonProperty("name")
    String name;

    @JsonProperty("inherit_from_parent")
    Boolean inheritFromParent;

    @JsonProperty("reset")
    Boolean reset;

    @JsonProperty("rules")
    @Builder.Default
    List<PolicyRule> rules = Collections.emptyList();
}
