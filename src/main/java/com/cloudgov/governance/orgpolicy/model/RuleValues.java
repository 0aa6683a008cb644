/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.orgpolicy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Values of an allow or deny rule: either {@code all} or an explicit value set.
 */
@Builder(toBuilder = true)
@Jacksonized
@Value
public class RuleValues {
    @JsonProperty("all")
    Boolean all;

    @JsonProperty("values")
    @JsonDeserialize(as = LinkedHashSet.class)
    Set<String> values;

    public static RuleValues all(boolean all) {
        return RuleValues.builder().all(all).build();
    }

    public static RuleValues of(String... values) {
        return RuleValues.builder().values(new LinkedHashSet<>(Arrays.asList(values))).build();
    }
}
