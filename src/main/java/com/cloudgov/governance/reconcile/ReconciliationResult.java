/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.reconcile;

import com.cloudgov.governance.iam.model.BindingOperationSet;
import com.cloudgov.governance.identity.IdentityDependency;
import com.cloudgov.governance.identity.ServiceIdentity;
import com.cloudgov.governance.orgpolicy.model.OrgPolicy;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

@Builder
@Value
public class ReconciliationResult {
    @NonNull
    BindingOperationSet bindings;
    @NonNull
    SortedMap<String, OrgPolicy> orgPolicies;
    @NonNull
    List<ServiceIdentity> eagerIdentities;
    @NonNull
    ApplyPlan applyPlan;
    // shortcode to principal for identities that are already resolvable
    @NonNull
    Map<String, String> discovery;

    public List<IdentityDependency> getDependencies() {
        return bindings.getDependencies();
    }
}
