/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.iam.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical form of the IAM inputs. Duplicates are legal here and are merged by the binding merger.
 */
@Builder(toBuilder = true)
@Value
public class NormalizedBindings {
    @NonNull
    List<Binding> bindings;
    // roles declared by an authoritative shape, including roles declared with no members
    @NonNull
    Set<String> declaredAuthoritativeRoles;
    // shapes, other than iam_policy, that were supplied non-empty
    @NonNull
    Set<BindingSource> declaredSources;
    Map<String, Set<String>> iamPolicy;

    public Optional<Map<String, Set<String>>> getIamPolicy() {
        return Optional.ofNullable(iamPolicy);
    }
}
