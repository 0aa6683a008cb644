/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.errorcode;

import lombok.Getter;

public enum ReconciliationErrorCode {
    /* IAM input errors */
    // authoritative iam_policy combined with any other IAM shape
    CONFIG_CONFLICT(ReconciliationErrorType.IAM_CONFIG_ERROR),

    /* Service identity errors */
    UNKNOWN_SHORTCODE(ReconciliationErrorType.SERVICE_IDENTITY_ERROR),
    MALFORMED_PRINCIPAL(ReconciliationErrorType.SERVICE_IDENTITY_ERROR),

    /* Organization policy errors */
    INVALID_POLICY_RULE(ReconciliationErrorType.ORG_POLICY_ERROR),
    DUPLICATE_POLICY_KEY(ReconciliationErrorType.ORG_POLICY_ERROR);

    @Getter
    private final ReconciliationErrorType errorType;

    ReconciliationErrorCode(ReconciliationErrorType errorType) {
        this.errorType = errorType;
    }
}
