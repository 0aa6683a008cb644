/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.orgpolicy;

import com.cloudgov.governance.errorcode.ReconciliationErrorCode;
import com.cloudgov.governance.errorcode.ReconciliationErrorType;
import com.cloudgov.governance.orgpolicy.exceptions.DuplicatePolicyKeyException;
import com.cloudgov.governance.orgpolicy.exceptions.InvalidPolicyRuleException;
import com.cloudgov.governance.orgpolicy.model.OrgPolicy;
import com.cloudgov.governance.orgpolicy.model.PolicyRule;
import com.cloudgov.governance.orgpolicy.model.RuleCondition;
import com.cloudgov.governance.orgpolicy.model.RuleValues;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OrgPolicyValidatorTest {
    private static final String KEY = "compute.vmExternalIpAccess";

    private final OrgPolicyValidator validator = new OrgPolicyValidator();

    private static OrgPolicy withRules(PolicyRule... rules) {
        return OrgPolicy.builder().rules(Arrays.asList(rules)).build();
    }

    @Test
    void GIVEN_well_formed_policies_WHEN_validate_THEN_accepted() {
        assertDoesNotThrow(() -> validator.validate(KEY, null));
        assertDoesNotThrow(() -> validator.validate(KEY, OrgPolicy.builder().build()));
        assertDoesNotThrow(() -> validator.validate(KEY, OrgPolicy.builder().name(KEY).reset(true).build()));
        assertDoesNotThrow(() -> validator.validate(KEY, withRules(
                PolicyRule.enforced(true),
                PolicyRule.builder().allow(RuleValues.of("projects/a", "projects/b"))
                        .condition(RuleCondition.builder().expression("resource.matchTag('1/env', 'dev')").build())
                        .build(),
                PolicyRule.builder().deny(RuleValues.all(true)).build(),
                // conditional rule with no effect of its own
                PolicyRule.builder().condition(RuleCondition.builder().title("noop").build()).build())));
    }

    @Test
    void GIVEN_name_different_from_key_WHEN_validate_THEN_duplicate_policy_key() {
        OrgPolicy policy = OrgPolicy.builder().name("compute.requireOsLogin").build();

        DuplicatePolicyKeyException e =
                assertThrows(DuplicatePolicyKeyException.class, () -> validator.validate(KEY, policy));
        assertThat(e.getOffendingKey(), equalTo(KEY));
        assertThat(e.getErrorType(), equalTo(ReconciliationErrorType.ORG_POLICY_ERROR));
    }

    @Test
    void GIVEN_rule_with_enforce_and_allow_WHEN_validate_THEN_invalid_rule_at_index() {
        OrgPolicy policy = withRules(PolicyRule.enforced(true),
                PolicyRule.builder().enforce(false).allow(RuleValues.all(true)).build());

        InvalidPolicyRuleException e =
                assertThrows(InvalidPolicyRuleException.class, () -> validator.validate(KEY, policy));
        assertThat(e.getErrorCode(), equalTo(ReconciliationErrorCode.INVALID_POLICY_RULE));
        assertThat(e.getOffendingKey(), equalTo(KEY));
        assertThat(e.getRuleIndex(), is(1));
    }

    @Test
    void GIVEN_rule_with_allow_and_deny_WHEN_validate_THEN_invalid_rule() {
        OrgPolicy policy = withRules(
                PolicyRule.builder().allow(RuleValues.of("a")).deny(RuleValues.of("b")).build());

        assertThrows(InvalidPolicyRuleException.class, () -> validator.validate(KEY, policy));
    }

    @Test
    void GIVEN_values_without_content_WHEN_validate_THEN_invalid_rule() {
        OrgPolicy noContent = withRules(PolicyRule.builder().deny(RuleValues.builder().build()).build());
        OrgPolicy emptyValues = withRules(PolicyRule.builder()
                .allow(RuleValues.builder().values(Collections.emptySet()).build()).build());

        assertThrows(InvalidPolicyRuleException.class, () -> validator.validate(KEY, noContent));
        assertThrows(InvalidPolicyRuleException.class, () -> validator.validate(KEY, emptyValues));
    }

    @Test
    void GIVEN_values_with_all_and_list_WHEN_validate_THEN_invalid_rule() {
        OrgPolicy policy = withRules(PolicyRule.builder()
                .allow(RuleValues.builder().all(true).values(Collections.singleton("a")).build()).build());

        assertThrows(InvalidPolicyRuleException.class, () -> validator.validate(KEY, policy));
    }

    @Test
    void GIVEN_null_rule_WHEN_validate_THEN_invalid_rule() {
        OrgPolicy policy = OrgPolicy.builder().rules(Arrays.asList(PolicyRule.enforced(true), null)).build();

        InvalidPolicyRuleException e =
                assertThrows(InvalidPolicyRuleException.class, () -> validator.validate(KEY, policy));
        assertThat(e.getRuleIndex(), is(1));
    }
}
