/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.reconcile;

import com.cloudgov.governance.iam.model.IamInputs;
import com.cloudgov.governance.orgpolicy.model.OrgPolicy;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Everything one reconciliation pass consumes. All inputs are already parsed by their collaborators.
 */
@Builder(toBuilder = true)
@Value
public class ReconciliationRequest {
    @Builder.Default
    IamInputs iam = IamInputs.builder().build();

    @Builder.Default
    Map<String, OrgPolicy> inlineOrgPolicies = Collections.emptyMap();

    @Builder.Default
    Map<String, OrgPolicy> fileOrgPolicies = Collections.emptyMap();

    // services enabled on the container, for example pubsub.googleapis.com
    @Builder.Default
    Set<String> services = Collections.emptySet();

    // shortcode to principal, as reported by the provisioning layer for identities it already created
    @Builder.Default
    Map<String, String> materializedPrincipals = Collections.emptyMap();

    // numeric container identifier once the container exists; null before creation
    String containerNumber;
}
