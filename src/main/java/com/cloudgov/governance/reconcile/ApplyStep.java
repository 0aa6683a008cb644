/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.reconcile;

import lombok.NonNull;
import lombok.Value;

import java.util.Comparator;

/**
 * One provisioning call. The target is a service, a shortcode, a role or a constraint name depending on the type;
 * member is only set for additive bindings.
 */
@Value
public class ApplyStep implements Comparable<ApplyStep> {
    static final String IAM_POLICY_TARGET = "iam_policy";
    private static final Comparator<ApplyStep> ORDER = Comparator.comparing(ApplyStep::getType)
            .thenComparing(ApplyStep::getTarget)
            .thenComparing(ApplyStep::getMember, Comparator.nullsFirst(Comparator.naturalOrder()));

    @NonNull
    StepType type;
    @NonNull
    String target;
    String member;

    public static ApplyStep activateService(String service) {
        return new ApplyStep(StepType.ACTIVATE_SERVICE, service, null);
    }

    public static ApplyStep materializeIdentity(String shortcode) {
        return new ApplyStep(StepType.MATERIALIZE_IDENTITY, shortcode, null);
    }

    public static ApplyStep setIamPolicy() {
        return new ApplyStep(StepType.SET_IAM_POLICY, IAM_POLICY_TARGET, null);
    }

    public static ApplyStep setAuthoritativeBinding(String role) {
        return new ApplyStep(StepType.SET_AUTHORITATIVE_BINDING, role, null);
    }

    public static ApplyStep addAdditiveBinding(String role, String member) {
        return new ApplyStep(StepType.ADD_ADDITIVE_BINDING, role, member);
    }

    public static ApplyStep setOrgPolicy(String constraint) {
        return new ApplyStep(StepType.SET_ORG_POLICY, constraint, null);
    }

    @Override
    public int compareTo(ApplyStep other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return member == null ? type + "(" + target + ")" : type + "(" + target + ", " + member + ")";
    }
}
