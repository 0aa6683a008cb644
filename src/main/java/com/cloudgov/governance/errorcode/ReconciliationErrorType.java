/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.errorcode;

public enum ReconciliationErrorType {
    IAM_CONFIG_ERROR,
    SERVICE_IDENTITY_ERROR,
    ORG_POLICY_ERROR
}
