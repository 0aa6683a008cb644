/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.orgpolicy.exceptions;

import com.cloudgov.governance.errorcode.ReconciliationErrorCode;
import com.cloudgov.governance.exceptions.ReconciliationException;
import lombok.Getter;

public class InvalidPolicyRuleException extends ReconciliationException {
    static final long serialVersionUID = -1385226941716045339L;

    @Getter
    private final int ruleIndex;

    public InvalidPolicyRuleException(String message, String policyName, int ruleIndex) {
        super(message, ReconciliationErrorCode.INVALID_POLICY_RULE, policyName);
        this.ruleIndex = ruleIndex;
    }
}
