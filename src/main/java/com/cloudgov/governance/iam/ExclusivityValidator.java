/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.iam;

import com.cloudgov.governance.iam.exceptions.ConfigConflictException;
import com.cloudgov.governance.iam.model.Binding;
import com.cloudgov.governance.iam.model.BindingSource;
import com.cloudgov.governance.iam.model.NormalizedBindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.TreeSet;

/**
 * Rejects inputs that combine the full-authority iam_policy with any other IAM shape.
 *
 * <p>GROUP and ROLE_AUTHORITATIVE declaring the same role is not a conflict: both contribute to the same
 * authoritative member set and are unioned by the merger.
 */
public class ExclusivityValidator {
    private static final Logger logger = LoggerFactory.getLogger(ExclusivityValidator.class);

    /**
     * Validate mode exclusivity.
     *
     * @param normalized normalized IAM inputs
     * @throws ConfigConflictException if iam_policy is present together with any other non-empty shape
     */
    public void validate(NormalizedBindings normalized) throws ConfigConflictException {
        if (!normalized.getIamPolicy().isPresent()) {
            logSharedAuthoritativeRoles(normalized);
            return;
        }
        if (normalized.getDeclaredSources().isEmpty()) {
            return;
        }
        String offendingRole = firstDeclaredRole(normalized);
        throw new ConfigConflictException(String.format(
                "iam_policy is authoritative for the whole container and cannot be combined with %s (role %s)",
                normalized.getDeclaredSources(), offendingRole), offendingRole);
    }

    private static String firstDeclaredRole(NormalizedBindings normalized) {
        Set<String> roles = new TreeSet<>(normalized.getDeclaredAuthoritativeRoles());
        for (Binding binding : normalized.getBindings()) {
            roles.add(binding.getRole());
        }
        // a shape with keys but no roles still counts; report the shape itself then
        return roles.isEmpty() ? normalized.getDeclaredSources().iterator().next().name() : roles.iterator().next();
    }

    private static void logSharedAuthoritativeRoles(NormalizedBindings normalized) {
        if (!normalized.getDeclaredSources().contains(BindingSource.GROUP)
                || !normalized.getDeclaredSources().contains(BindingSource.ROLE_AUTHORITATIVE)) {
            return;
        }
        Set<String> groupRoles = new TreeSet<>();
        Set<String> roleKeyedRoles = new TreeSet<>();
        for (Binding binding : normalized.getBindings()) {
            if (binding.getSource() == BindingSource.GROUP) {
                groupRoles.add(binding.getRole());
            } else if (binding.getSource() == BindingSource.ROLE_AUTHORITATIVE) {
                roleKeyedRoles.add(binding.getRole());
            }
        }
        groupRoles.retainAll(roleKeyedRoles);
        if (!groupRoles.isEmpty()) {
            logger.atInfo().addKeyValue("roles", groupRoles)
                    .log("Roles declared by both group_iam and iam, their members are unioned");
        }
    }
}
