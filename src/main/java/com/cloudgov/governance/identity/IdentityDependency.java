/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity;

import com.cloudgov.governance.iam.model.BindingSource;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Comparator;

/**
 * Ordering edge emitted for the provisioning layer: the binding (role, member, source) may only be applied after the
 * service identity behind shortcode has been materialized.
 */
@Builder
@Value
public class IdentityDependency implements Comparable<IdentityDependency> {
    private static final Comparator<IdentityDependency> ORDER = Comparator
            .comparing(IdentityDependency::getShortcode)
            .thenComparing(IdentityDependency::getRole)
            .thenComparing(IdentityDependency::getMember)
            .thenComparing(IdentityDependency::getSource);

    @NonNull
    String role;
    @NonNull
    String member;
    @NonNull
    BindingSource source;
    @NonNull
    String shortcode;
    @NonNull
    String service;

    @Override
    public int compareTo(IdentityDependency other) {
        return ORDER.compare(this, other);
    }
}
