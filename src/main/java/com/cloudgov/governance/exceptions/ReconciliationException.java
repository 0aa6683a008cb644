/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.exceptions;

import com.cloudgov.governance.errorcode.ReconciliationErrorCode;
import com.cloudgov.governance.errorcode.ReconciliationErrorType;
import lombok.Getter;

// root class for all reconciliation failures. The offending key is a role, a shortcode or a policy name,
// depending on which component rejected the input.
@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class ReconciliationException extends Exception {
    static final long serialVersionUID = -2207563452904398512L;

    @Getter
    private final ReconciliationErrorCode errorCode;
    @Getter
    private final String offendingKey;

    public ReconciliationException(String message, ReconciliationErrorCode errorCode, String offendingKey) {
        super(message);
        this.errorCode = errorCode;
        this.offendingKey = offendingKey;
    }

    public ReconciliationException(String message, Throwable cause, ReconciliationErrorCode errorCode,
                                   String offendingKey) {
        super(message, cause);
        this.errorCode = errorCode;
        this.offendingKey = offendingKey;
    }

    public ReconciliationErrorType getErrorType() {
        return errorCode.getErrorType();
    }
}
