/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.iam.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Comparator;

/**
 * An additive (role, member) fact.
 */
@Value(staticConstructor = "of")
public class RoleMember implements Comparable<RoleMember> {
    private static final Comparator<RoleMember> ORDER = Comparator.comparing(RoleMember::getRole)
            .thenComparing(RoleMember::getMember);

    @NonNull
    String role;
    @NonNull
    String member;

    @Override
    public int compareTo(RoleMember other) {
        return ORDER.compare(this, other);
    }
}
