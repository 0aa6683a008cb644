/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.iam.model;

import com.cloudgov.governance.identity.IdentityDependency;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Final IAM operations for the provisioning layer to apply verbatim.
 *
 * <p>{@code authoritative} maps each role to the complete member set the container must end up with for that role.
 * Any member currently bound to such a role and missing from the set is revoked. A role mapped to an empty set loses
 * all of its members.
 *
 * <p>{@code additive} pairs are granted alongside whatever else holds the role and never revoke anything.
 *
 * <p>{@code fullPolicy} is only present in iam_policy mode. It then replaces the entire IAM state of the container,
 * and both other partitions are empty.
 */
@Builder
@Value
public class BindingOperationSet {
    @NonNull
    SortedMap<String, SortedSet<String>> authoritative;
    @NonNull
    SortedSet<RoleMember> additive;
    Map<String, Set<String>> fullPolicy;
    @NonNull
    List<IdentityDependency> dependencies;

    public Optional<Map<String, Set<String>>> getFullPolicy() {
        return Optional.ofNullable(fullPolicy);
    }

    public boolean isFullPolicyMode() {
        return fullPolicy != null;
    }

    /**
     * Members the container will hold for a role through authoritative bindings.
     *
     * @param role role name
     * @return member set, empty if the role is not authoritatively managed
     */
    public Set<String> authoritativeMembers(String role) {
        SortedSet<String> members = authoritative.get(role);
        return members == null ? Collections.emptySet() : members;
    }
}
