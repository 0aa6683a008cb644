/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity.exceptions;

import com.cloudgov.governance.errorcode.ReconciliationErrorCode;
import com.cloudgov.governance.exceptions.ReconciliationException;

public class MalformedPrincipalException extends ReconciliationException {
    static final long serialVersionUID = 2870553189146710026L;

    public MalformedPrincipalException(String message, String shortcode) {
        super(message, ReconciliationErrorCode.MALFORMED_PRINCIPAL, shortcode);
    }
}
