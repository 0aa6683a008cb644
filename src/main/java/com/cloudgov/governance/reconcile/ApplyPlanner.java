/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.reconcile;

import com.cloudgov.governance.iam.model.BindingOperationSet;
import com.cloudgov.governance.iam.model.RoleMember;
import com.cloudgov.governance.identity.IdentityDependency;
import com.cloudgov.governance.identity.ServiceIdentity;
import com.cloudgov.governance.util.DependencyOrder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns the reconciled state into ordered provisioning steps. Identity materialization follows the activation of its
 * service when that service is enabled on the container, and a binding follows the materialization of every eager
 * identity it references.
 */
public class ApplyPlanner {

    /**
     * Build the plan.
     *
     * @param enabledServices services enabled on the container
     * @param eagerIdentities identities to create together with the container
     * @param bindings        merged IAM operations
     * @param orgPolicies     effective org policies
     * @return ordered plan
     */
    public ApplyPlan plan(Collection<String> enabledServices, List<ServiceIdentity> eagerIdentities,
                          BindingOperationSet bindings, Map<String, ?> orgPolicies) {
        Set<String> services =
                enabledServices == null ? Collections.emptySortedSet() : new TreeSet<>(enabledServices);
        SortedMap<ApplyStep, Set<ApplyStep>> prerequisites = new TreeMap<>();

        for (String service : services) {
            prerequisites.put(ApplyStep.activateService(service), Collections.emptySet());
        }
        for (ServiceIdentity identity : eagerIdentities) {
            addMaterialization(prerequisites, services, identity.getShortcode(), identity.getService());
        }
        for (IdentityDependency dependency : bindings.getDependencies()) {
            addMaterialization(prerequisites, services, dependency.getShortcode(), dependency.getService());
        }

        if (bindings.isFullPolicyMode()) {
            prerequisites.put(ApplyStep.setIamPolicy(), materializationsFor(bindings.getDependencies(), null, null,
                    true));
        } else {
            for (String role : bindings.getAuthoritative().keySet()) {
                prerequisites.put(ApplyStep.setAuthoritativeBinding(role),
                        materializationsFor(bindings.getDependencies(), role, null, true));
            }
            for (RoleMember pair : bindings.getAdditive()) {
                prerequisites.put(ApplyStep.addAdditiveBinding(pair.getRole(), pair.getMember()),
                        materializationsFor(bindings.getDependencies(), pair.getRole(), pair.getMember(), false));
            }
        }
        for (String constraint : orgPolicies.keySet()) {
            prerequisites.put(ApplyStep.setOrgPolicy(constraint), Collections.emptySet());
        }

        List<ApplyStep> ordered = new ArrayList<>(
                new DependencyOrder<ApplyStep>().computeOrderedDependencies(prerequisites.keySet(),
                        prerequisites::get));
        return new ApplyPlan(Collections.unmodifiableList(ordered), Collections.unmodifiableSortedMap(prerequisites));
    }

    private static void addMaterialization(Map<ApplyStep, Set<ApplyStep>> prerequisites, Set<String> services,
                                           String shortcode, String service) {
        ApplyStep step = ApplyStep.materializeIdentity(shortcode);
        if (prerequisites.containsKey(step)) {
            return;
        }
        prerequisites.put(step, services.contains(service)
                ? Collections.singleton(ApplyStep.activateService(service)) : Collections.emptySet());
    }

    // role == null matches every role; member == null matches every member
    private static Set<ApplyStep> materializationsFor(List<IdentityDependency> dependencies, String role,
                                                      String member, boolean authoritative) {
        Set<ApplyStep> steps = new TreeSet<>();
        for (IdentityDependency dependency : dependencies) {
            if (dependency.getSource().isAuthoritative() != authoritative) {
                continue;
            }
            if (role != null && !role.equals(dependency.getRole())) {
                continue;
            }
            if (member != null && !member.equals(dependency.getMember())) {
                continue;
            }
            steps.add(ApplyStep.materializeIdentity(dependency.getShortcode()));
        }
        return steps.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(steps);
    }
}
