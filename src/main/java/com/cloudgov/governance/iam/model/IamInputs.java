/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.iam.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The five IAM input shapes, as parsed by the caller.
 */
@Builder(toBuilder = true)
@Value
public class IamInputs {
    /** Authoritative, keyed by group: group email to roles. */
    @Builder.Default
    Map<String, List<String>> groupIam = Collections.emptyMap();

    /** Authoritative, keyed by role: role to members. */
    @Builder.Default
    Map<String, List<String>> iam = Collections.emptyMap();

    /** Additive, keyed by role: role to members. */
    @Builder.Default
    Map<String, List<String>> iamAdditive = Collections.emptyMap();

    /** Additive, keyed by member: member to roles. */
    @Builder.Default
    Map<String, List<String>> iamAdditiveMembers = Collections.emptyMap();

    /** Full-authority policy, role to members. Null when absent; when present nothing else may be set. */
    Map<String, List<String>> iamPolicy;
}
