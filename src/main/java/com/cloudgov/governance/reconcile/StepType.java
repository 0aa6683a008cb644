/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.reconcile;

public enum StepType {
    ACTIVATE_SERVICE,
    MATERIALIZE_IDENTITY,
    SET_IAM_POLICY,
    SET_AUTHORITATIVE_BINDING,
    ADD_ADDITIVE_BINDING,
    SET_ORG_POLICY
}
