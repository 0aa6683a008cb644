/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity;

import com.cloudgov.governance.iam.BindingNormalizer;
import com.cloudgov.governance.iam.model.Binding;
import com.cloudgov.governance.iam.model.BindingSource;
import com.cloudgov.governance.iam.model.IamInputs;
import com.cloudgov.governance.identity.exceptions.UnknownShortcodeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShortcodeResolverTest {
    private static final String CLOUDSERVICES_TEMPLATE =
            "serviceAccount:${container.number}@cloudservices.gserviceaccount.com";

    private final BindingNormalizer normalizer = new BindingNormalizer();
    private ServiceIdentityRegistry registry;
    private ShortcodeResolver resolver;

    @BeforeEach
    void beforeEach() throws IOException {
        registry = new ServiceIdentityRegistry(ShortcodeTableTest.readTable("eager_cloudservices.yaml"));
        resolver = new ShortcodeResolver(registry);
    }

    @Test
    void GIVEN_members_WHEN_is_shortcode_THEN_only_untyped_non_special_members_qualify() {
        assertTrue(ShortcodeResolver.isShortcode("cloudservices"));
        assertTrue(ShortcodeResolver.isShortcode("container-engine"));
        assertFalse(ShortcodeResolver.isShortcode("user:a@example.com"));
        assertFalse(ShortcodeResolver.isShortcode("group:devs@example.com"));
        assertFalse(ShortcodeResolver.isShortcode("allUsers"));
        assertFalse(ShortcodeResolver.isShortcode("allAuthenticatedUsers"));
        assertFalse(ShortcodeResolver.isShortcode(null));
    }

    @Test
    void GIVEN_eager_shortcode_in_additive_binding_WHEN_resolve_THEN_member_rewritten_and_edge_emitted()
            throws Exception {
        IamInputs inputs = IamInputs.builder()
                .iamAdditive(Collections.singletonMap("roles/editor", Collections.singletonList("cloudservices")))
                .build();

        ResolvedBindings resolved = resolver.resolve(normalizer.normalize(inputs));

        assertThat(resolved.getBindings().getBindings(),
                contains(Binding.of("roles/editor", CLOUDSERVICES_TEMPLATE, BindingSource.ROLE_ADDITIVE)));
        assertThat(resolved.getDependencies(), contains(IdentityDependency.builder()
                .role("roles/editor")
                .member(CLOUDSERVICES_TEMPLATE)
                .source(BindingSource.ROLE_ADDITIVE)
                .shortcode("cloudservices")
                .service("cloudapis.googleapis.com")
                .build()));
    }

    @Test
    void GIVEN_materialized_eager_identity_WHEN_resolve_THEN_concrete_principal_used_and_edge_kept()
            throws Exception {
        String principal = "serviceAccount:123456@cloudservices.gserviceaccount.com";
        registry.materialize("cloudservices", principal);
        IamInputs inputs = IamInputs.builder()
                .iam(Collections.singletonMap("roles/editor", Collections.singletonList("cloudservices")))
                .build();

        ResolvedBindings resolved = resolver.resolve(normalizer.normalize(inputs));

        assertThat(resolved.getBindings().getBindings(),
                contains(Binding.of("roles/editor", principal, BindingSource.ROLE_AUTHORITATIVE)));
        assertThat(resolved.getDependencies().size(), is(1));
        assertThat(resolved.getDependencies().get(0).getMember(), equalTo(principal));
    }

    @Test
    void GIVEN_non_eager_shortcode_WHEN_resolve_THEN_rewritten_without_edge() throws Exception {
        IamInputs inputs = IamInputs.builder()
                .iamAdditiveMembers(Collections.singletonMap("storage", Collections.singletonList("roles/viewer")))
                .build();

        ResolvedBindings resolved = resolver.resolve(normalizer.normalize(inputs));

        assertThat(resolved.getBindings().getBindings().get(0).getMember(),
                equalTo("serviceAccount:service-${container.number}@gs-project-accounts.iam.gserviceaccount.com"));
        assertThat(resolved.getDependencies(), is(empty()));
    }

    @Test
    void GIVEN_typed_and_special_members_WHEN_resolve_THEN_left_untouched() throws Exception {
        IamInputs inputs = IamInputs.builder()
                .iamAdditive(Collections.singletonMap("roles/viewer",
                        Arrays.asList("user:a@example.com", "allUsers", "allAuthenticatedUsers")))
                .build();

        ResolvedBindings resolved = resolver.resolve(normalizer.normalize(inputs));

        assertThat(resolved.getBindings().getBindings(), contains(
                Binding.of("roles/viewer", "user:a@example.com", BindingSource.ROLE_ADDITIVE),
                Binding.of("roles/viewer", "allUsers", BindingSource.ROLE_ADDITIVE),
                Binding.of("roles/viewer", "allAuthenticatedUsers", BindingSource.ROLE_ADDITIVE)));
        assertThat(registry.registeredIdentities(), is(empty()));
    }

    @Test
    void GIVEN_shortcode_in_iam_policy_WHEN_resolve_THEN_policy_rewritten_with_edge() throws Exception {
        IamInputs inputs = IamInputs.builder()
                .iamPolicy(Collections.singletonMap("roles/pubsub.publisher", Arrays.asList("pubsub", "user:a@x.com")))
                .build();

        ResolvedBindings resolved = resolver.resolve(normalizer.normalize(inputs));

        assertThat(resolved.getBindings().getIamPolicy().get().get("roles/pubsub.publisher"), contains(
                "serviceAccount:service-${container.number}@gcp-sa-pubsub.iam.gserviceaccount.com", "user:a@x.com"));
        assertThat(resolved.getDependencies().size(), is(1));
        assertThat(resolved.getDependencies().get(0).getSource(), equalTo(BindingSource.IAM_POLICY));
        assertThat(resolved.getDependencies().get(0).getShortcode(), equalTo("pubsub"));
    }

    @Test
    void GIVEN_unknown_shortcode_WHEN_resolve_THEN_unknown_shortcode_error() {
        IamInputs inputs = IamInputs.builder()
                .iam(Collections.singletonMap("roles/editor", Collections.singletonList("not-a-service")))
                .build();

        UnknownShortcodeException e =
                assertThrows(UnknownShortcodeException.class, () -> resolver.resolve(normalizer.normalize(inputs)));
        assertThat(e.getOffendingKey(), equalTo("not-a-service"));
    }

    @Test
    void GIVEN_same_shortcode_in_two_bindings_WHEN_resolve_THEN_one_identity_registered() throws Exception {
        IamInputs inputs = IamInputs.builder()
                .iam(Collections.singletonMap("roles/editor", Collections.singletonList("cloudservices")))
                .iamAdditive(Collections.singletonMap("roles/viewer", Collections.singletonList("cloudservices")))
                .build();

        ResolvedBindings resolved = resolver.resolve(normalizer.normalize(inputs));

        assertThat(registry.registeredIdentities().size(), is(1));
        assertThat(resolved.getDependencies().size(), is(2));
    }
}
