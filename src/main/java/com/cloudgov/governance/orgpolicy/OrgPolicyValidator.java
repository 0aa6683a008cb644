/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.orgpolicy;

import com.cloudgov.governance.orgpolicy.exceptions.DuplicatePolicyKeyException;
import com.cloudgov.governance.orgpolicy.exceptions.InvalidPolicyRuleException;
import com.cloudgov.governance.orgpolicy.model.OrgPolicy;
import com.cloudgov.governance.orgpolicy.model.PolicyRule;
import com.cloudgov.governance.orgpolicy.model.RuleValues;
import com.cloudgov.governance.util.Utils;

import java.util.List;

public class OrgPolicyValidator {

    /**
     * Validate the shape of a policy stored under a constraint key.
     *
     * @param key    constraint name the policy is stored under
     * @param policy policy, null is treated as a policy without rules
     * @throws DuplicatePolicyKeyException if the policy declares a name different from its key
     * @throws InvalidPolicyRuleException  if any rule is malformed
     */
    public void validate(String key, OrgPolicy policy) throws DuplicatePolicyKeyException, InvalidPolicyRuleException {
        if (policy == null) {
            return;
        }
        if (policy.getName() != null && !policy.getName().equals(key)) {
            throw new DuplicatePolicyKeyException(String.format(
                    "Org policy stored under %s declares the name %s", key, policy.getName()), key);
        }
        List<PolicyRule> rules = Utils.nullEmpty(policy.getRules());
        for (int i = 0; i < rules.size(); i++) {
            validateRule(key, i, rules.get(i));
        }
    }

    private static void validateRule(String key, int index, PolicyRule rule) throws InvalidPolicyRuleException {
        if (rule == null) {
            throw new InvalidPolicyRuleException(String.format("Rule %d of org policy %s is empty", index, key), key,
                    index);
        }
        int kinds = 0;
        if (rule.getEnforce() != null) {
            kinds++;
        }
        if (rule.getAllow() != null) {
            kinds++;
        }
        if (rule.getDeny() != null) {
            kinds++;
        }
        if (kinds > 1) {
            throw new InvalidPolicyRuleException(String.format(
                    "Rule %d of org policy %s sets more than one of enforce, allow and deny", index, key), key, index);
        }
        validateValues(key, index, "allow", rule.getAllow());
        validateValues(key, index, "deny", rule.getDeny());
    }

    private static void validateValues(String key, int index, String kind, RuleValues values)
            throws InvalidPolicyRuleException {
        if (values == null) {
            return;
        }
        boolean hasAll = values.getAll() != null;
        boolean hasValues = !Utils.isEmpty(values.getValues());
        if (!hasAll && !hasValues) {
            throw new InvalidPolicyRuleException(String.format(
                    "Rule %d of org policy %s: %s needs either all or values", index, key, kind), key, index);
        }
        if (hasAll && hasValues) {
            throw new InvalidPolicyRuleException(String.format(
                    "Rule %d of org policy %s: %s cannot set both all and values", index, key, kind), key, index);
        }
    }
}
