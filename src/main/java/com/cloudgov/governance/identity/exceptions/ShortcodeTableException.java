/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity.exceptions;

/**
 * Thrown when the static service identity table cannot be loaded or is inconsistent.
 */
public class ShortcodeTableException extends RuntimeException {
    static final long serialVersionUID = 5923318021871124409L;

    public ShortcodeTableException(String message) {
        super(message);
    }

    public ShortcodeTableException(String message, Throwable e) {
        super(message, e);
    }
}
