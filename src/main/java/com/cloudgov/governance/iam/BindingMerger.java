/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.iam;

import com.cloudgov.governance.iam.model.Binding;
import com.cloudgov.governance.iam.model.BindingOperationSet;
import com.cloudgov.governance.iam.model.NormalizedBindings;
import com.cloudgov.governance.iam.model.RoleMember;
import com.cloudgov.governance.identity.ResolvedBindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Combines resolved bindings into the operation set the provisioning layer applies.
 *
 * <p>Authoritative sources (GROUP and ROLE_AUTHORITATIVE) are unioned per role, and the union replaces the role's
 * member set: members not in it are revoked. Additive sources (ROLE_ADDITIVE and MEMBER_ADDITIVE) are unioned as
 * independent (role, member) facts that never revoke. In iam_policy mode the policy alone is the IAM state.
 *
 * <p>Output collections are sorted, so the result does not depend on input iteration order.
 */
public class BindingMerger {
    private static final Logger logger = LoggerFactory.getLogger(BindingMerger.class);

    /**
     * Merge resolved bindings.
     *
     * @param resolved bindings with shortcodes resolved, already validated for exclusivity
     * @return partitioned operation set
     */
    public BindingOperationSet merge(ResolvedBindings resolved) {
        NormalizedBindings normalized = resolved.getBindings();
        Optional<Map<String, Set<String>>> iamPolicy = normalized.getIamPolicy();
        if (iamPolicy.isPresent()) {
            logger.atInfo().addKeyValue("roles", iamPolicy.get().size())
                    .log("iam_policy present, it replaces the entire IAM state");
            return BindingOperationSet.builder()
                    .authoritative(Collections.emptySortedMap())
                    .additive(Collections.emptySortedSet())
                    .fullPolicy(iamPolicy.get())
                    .dependencies(resolved.getDependencies())
                    .build();
        }

        SortedMap<String, SortedSet<String>> authoritative = new TreeMap<>();
        // a declared role with no members is still authoritative: every current member is revoked
        for (String role : normalized.getDeclaredAuthoritativeRoles()) {
            authoritative.put(role, new TreeSet<>());
        }
        SortedSet<RoleMember> additive = new TreeSet<>();
        for (Binding binding : normalized.getBindings()) {
            if (binding.getSource().isAuthoritative()) {
                authoritative.computeIfAbsent(binding.getRole(), k -> new TreeSet<>()).add(binding.getMember());
            } else {
                additive.add(RoleMember.of(binding.getRole(), binding.getMember()));
            }
        }

        for (RoleMember pair : additive) {
            if (authoritative.getOrDefault(pair.getRole(), Collections.emptySortedSet()).contains(pair.getMember())) {
                logger.atDebug().addKeyValue("role", pair.getRole()).addKeyValue("member", pair.getMember())
                        .log("Member granted both authoritatively and additively, overlap is harmless");
            }
        }

        SortedMap<String, SortedSet<String>> frozen = new TreeMap<>();
        authoritative.forEach((role, members) -> frozen.put(role, Collections.unmodifiableSortedSet(members)));
        logger.atInfo().addKeyValue("authoritativeRoles", frozen.size()).addKeyValue("additivePairs", additive.size())
                .addKeyValue("dependencies", resolved.getDependencies().size()).log("Merged IAM bindings");
        return BindingOperationSet.builder()
                .authoritative(Collections.unmodifiableSortedMap(frozen))
                .additive(Collections.unmodifiableSortedSet(additive))
                .dependencies(resolved.getDependencies())
                .build();
    }
}
