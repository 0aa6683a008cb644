/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.iam;

import com.cloudgov.governance.errorcode.ReconciliationErrorCode;
import com.cloudgov.governance.errorcode.ReconciliationErrorType;
import com.cloudgov.governance.iam.exceptions.ConfigConflictException;
import com.cloudgov.governance.iam.model.IamInputs;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExclusivityValidatorTest {
    private static final Map<String, List<String>> POLICY =
            Collections.singletonMap("roles/owner", Collections.singletonList("user:a@example.com"));

    private final BindingNormalizer normalizer = new BindingNormalizer();
    private final ExclusivityValidator validator = new ExclusivityValidator();

    @Test
    void GIVEN_iam_policy_alone_WHEN_validate_THEN_accepted() {
        IamInputs inputs = IamInputs.builder().iamPolicy(POLICY).build();

        assertDoesNotThrow(() -> validator.validate(normalizer.normalize(inputs)));
    }

    @Test
    void GIVEN_empty_iam_policy_alone_WHEN_validate_THEN_accepted() {
        IamInputs inputs = IamInputs.builder().iamPolicy(Collections.emptyMap()).build();

        assertDoesNotThrow(() -> validator.validate(normalizer.normalize(inputs)));
    }

    @Test
    void GIVEN_iam_policy_and_iam_WHEN_validate_THEN_config_conflict_names_role() {
        IamInputs inputs = IamInputs.builder()
                .iamPolicy(POLICY)
                .iam(Collections.singletonMap("roles/editor", Collections.singletonList("user:b@example.com")))
                .build();

        ConfigConflictException e =
                assertThrows(ConfigConflictException.class, () -> validator.validate(normalizer.normalize(inputs)));
        assertThat(e.getErrorCode(), equalTo(ReconciliationErrorCode.CONFIG_CONFLICT));
        assertThat(e.getErrorType(), equalTo(ReconciliationErrorType.IAM_CONFIG_ERROR));
        assertThat(e.getOffendingKey(), equalTo("roles/editor"));
        assertThat(e.getMessage(), containsString("iam_policy"));
    }

    @Test
    void GIVEN_iam_policy_and_additive_members_WHEN_validate_THEN_first_role_is_reported() {
        IamInputs inputs = IamInputs.builder()
                .iamPolicy(POLICY)
                .iamAdditiveMembers(Collections.singletonMap("user:b@example.com",
                        Arrays.asList("roles/viewer", "roles/browser")))
                .build();

        ConfigConflictException e =
                assertThrows(ConfigConflictException.class, () -> validator.validate(normalizer.normalize(inputs)));
        assertThat(e.getOffendingKey(), equalTo("roles/browser"));
    }

    @Test
    void GIVEN_iam_policy_and_group_without_roles_WHEN_validate_THEN_shape_is_reported() {
        IamInputs inputs = IamInputs.builder()
                .iamPolicy(POLICY)
                .groupIam(Collections.singletonMap("devs@example.com", Collections.emptyList()))
                .build();

        ConfigConflictException e =
                assertThrows(ConfigConflictException.class, () -> validator.validate(normalizer.normalize(inputs)));
        assertThat(e.getOffendingKey(), equalTo("GROUP"));
    }

    @Test
    void GIVEN_group_iam_and_iam_on_same_role_WHEN_validate_THEN_accepted() {
        IamInputs inputs = IamInputs.builder()
                .groupIam(Collections.singletonMap("devs@example.com", Collections.singletonList("roles/viewer")))
                .iam(Collections.singletonMap("roles/viewer", Collections.singletonList("user:a@example.com")))
                .build();

        assertDoesNotThrow(() -> validator.validate(normalizer.normalize(inputs)));
    }

    @Test
    void GIVEN_all_four_non_policy_shapes_WHEN_validate_THEN_accepted() {
        IamInputs inputs = IamInputs.builder()
                .groupIam(Collections.singletonMap("devs@example.com", Collections.singletonList("roles/viewer")))
                .iam(Collections.singletonMap("roles/editor", Collections.singletonList("user:a@example.com")))
                .iamAdditive(Collections.singletonMap("roles/viewer", Collections.singletonList("user:b@example.com")))
                .iamAdditiveMembers(Collections.singletonMap("user:c@example.com",
                        Collections.singletonList("roles/browser")))
                .build();

        assertDoesNotThrow(() -> validator.validate(normalizer.normalize(inputs)));
    }
}
