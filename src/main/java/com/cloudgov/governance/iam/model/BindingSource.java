/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.iam.model;

import lombok.Getter;

/**
 * Which input shape a binding came from. Authoritative sources own the complete member set of their roles; additive
 * sources only add (role, member) pairs.
 *
 * <p>Only the first four constants are ever carried by a {@link Binding} or listed as a declared source of
 * {@link NormalizedBindings}. {@link #IAM_POLICY} tags the {@code IdentityDependency} edges of
 * shortcodes found in the full-authority policy, which bypasses binding normalization entirely.</p>
 */
public enum BindingSource {
    // group-keyed authoritative map; kept apart from ROLE_AUTHORITATIVE for diagnostics only
    GROUP(true),
    ROLE_AUTHORITATIVE(true),
    ROLE_ADDITIVE(false),
    MEMBER_ADDITIVE(false),
    // dependency edges only
    IAM_POLICY(true);

    @Getter
    private final boolean authoritative;

    BindingSource(boolean authoritative) {
        this.authoritative = authoritative;
    }
}
