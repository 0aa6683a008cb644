/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.iam.exceptions;

import com.cloudgov.governance.errorcode.ReconciliationErrorCode;
import com.cloudgov.governance.exceptions.ReconciliationException;

public class ConfigConflictException extends ReconciliationException {
    static final long serialVersionUID = 4419035262167315877L;

    public ConfigConflictException(String message, String role) {
        super(message, ReconciliationErrorCode.CONFIG_CONFLICT, role);
    }
}
