/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.orgpolicy.exceptions;

import com.cloudgov.governance.errorcode.ReconciliationErrorCode;
import com.cloudgov.governance.exceptions.ReconciliationException;

public class DuplicatePolicyKeyException extends ReconciliationException {
    static final long serialVersionUID = 8120947733468290155L;

    public DuplicatePolicyKeyException(String message, String policyName) {
        super(message, ReconciliationErrorCode.DUPLICATE_POLICY_KEY, policyName);
    }
}
