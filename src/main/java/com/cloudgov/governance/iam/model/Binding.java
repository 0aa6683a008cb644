/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.iam.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Comparator;

@Builder(toBuilder = true)
@Value
public class Binding implements Comparable<Binding> {
    private static final Comparator<Binding> ORDER = Comparator.comparing(Binding::getRole)
            .thenComparing(Binding::getMember)
            .thenComparing(Binding::getSource);

    @NonNull
    String role;
    @NonNull
    String member;
    @NonNull
    BindingSource source;

    public static Binding of(String role, String member, BindingSource source) {
        return new Binding(role, member, source);
    }

    public Binding withMember(String newMember) {
        return toBuilder().member(newMember).build();
    }

    @Override
    public int compareTo(Binding other) {
        return ORDER.compare(this, other);
    }
}
