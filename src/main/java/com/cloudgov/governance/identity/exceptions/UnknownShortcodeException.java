/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity.exceptions;

import com.cloudgov.governance.errorcode.ReconciliationErrorCode;
import com.cloudgov.governance.exceptions.ReconciliationException;

public class UnknownShortcodeException extends ReconciliationException {
    static final long serialVersionUID = -6620310528145561743L;

    public UnknownShortcodeException(String shortcode) {
        super("Unknown service identity shortcode: " + shortcode, ReconciliationErrorCode.UNKNOWN_SHORTCODE,
                shortcode);
    }

    public UnknownShortcodeException(String message, String shortcode) {
        super(message, ReconciliationErrorCode.UNKNOWN_SHORTCODE, shortcode);
    }
}
