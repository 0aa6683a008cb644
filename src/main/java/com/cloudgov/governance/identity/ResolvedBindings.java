/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity;

import com.cloudgov.governance.iam.model.NormalizedBindings;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Normalized bindings with every shortcode member rewritten to its principal form, and the ordering edges the
 * rewrite produced.
 */
@Value
public class ResolvedBindings {
    @NonNull
    NormalizedBindings bindings;
    @NonNull
    List<IdentityDependency> dependencies;
}
