/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.reconcile;

import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Provisioning steps in an order where every step comes after all of its prerequisites.
 */
@Value
public class ApplyPlan {
    @NonNull
    List<ApplyStep> steps;
    @NonNull
    Map<ApplyStep, Set<ApplyStep>> prerequisites;

    public Set<ApplyStep> prerequisitesOf(ApplyStep step) {
        return prerequisites.getOrDefault(step, Collections.emptySet());
    }
}
