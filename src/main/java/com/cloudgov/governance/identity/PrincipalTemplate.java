/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity;

import com.cloudgov.governance.util.Utils;
import lombok.Getter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Principal string with placeholders for the numeric container identifier. Only used to check that a principal
 * reported by the provisioning layer has the expected shape; principals are never rendered from a template here.
 */
public final class PrincipalTemplate {
    public static final String CONTAINER_NUMBER_PLACEHOLDER = "${container.number}";
    private static final String NUMBER_GROUP = "(\\d+)";

    @Getter
    private final String template;
    private final Pattern pattern;

    private PrincipalTemplate(String template) {
        this.template = template;
        String[] literals = template.split(Pattern.quote(CONTAINER_NUMBER_PLACEHOLDER), -1);
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < literals.length; i++) {
            if (i > 0) {
                regex.append(NUMBER_GROUP);
            }
            if (!literals[i].isEmpty()) {
                regex.append(Pattern.quote(literals[i]));
            }
        }
        this.pattern = Pattern.compile(regex.toString());
    }

    public static PrincipalTemplate of(String template) {
        return new PrincipalTemplate(template);
    }

    public boolean embedsContainerNumber() {
        return template.contains(CONTAINER_NUMBER_PLACEHOLDER);
    }

    /**
     * Check whether a concrete principal fits this template.
     *
     * @param principal       principal reported after materialization
     * @param containerNumber container number if already known, null otherwise
     * @return true if every placeholder position holds the same number, equal to containerNumber when given
     */
    public boolean matches(String principal, String containerNumber) {
        if (Utils.isEmpty(principal)) {
            return false;
        }
        Matcher matcher = pattern.matcher(principal);
        if (!matcher.matches()) {
            return false;
        }
        String expected = containerNumber;
        for (int g = 1; g <= matcher.groupCount(); g++) {
            String number = matcher.group(g);
            if (expected == null) {
                expected = number;
            } else if (!expected.equals(number)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return template;
    }
}
