/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity;

import com.cloudgov.governance.iam.model.Binding;
import com.cloudgov.governance.iam.model.BindingSource;
import com.cloudgov.governance.iam.model.NormalizedBindings;
import com.cloudgov.governance.identity.exceptions.UnknownShortcodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Rewrites shortcode members to the principal form of the service identity they stand for.
 *
 * <p>A member is a shortcode when it carries no principal type prefix and is not one of the special principals
 * {@code allUsers} or {@code allAuthenticatedUsers}. Bindings referencing an eager identity get a dependency edge on
 * that identity's materialization.
 */
public class ShortcodeResolver {
    private static final Logger logger = LoggerFactory.getLogger(ShortcodeResolver.class);
    private static final Set<String> SPECIAL_PRINCIPALS = Collections.unmodifiableSet(
            new LinkedHashSet<>(Arrays.asList("allUsers", "allAuthenticatedUsers")));

    private final ServiceIdentityRegistry registry;

    public ShortcodeResolver(ServiceIdentityRegistry registry) {
        this.registry = registry;
    }

    public static boolean isShortcode(String member) {
        return member != null && member.indexOf(':') < 0 && !SPECIAL_PRINCIPALS.contains(member);
    }

    /**
     * Resolve every shortcode member of the normalized bindings and of the iam_policy, if any.
     *
     * @param normalized normalized IAM inputs
     * @return resolved bindings plus dependency edges
     * @throws UnknownShortcodeException if a member looks like a shortcode but is not a known one
     */
    public ResolvedBindings resolve(NormalizedBindings normalized) throws UnknownShortcodeException {
        Set<IdentityDependency> dependencies = new TreeSet<>();

        List<Binding> resolved = new ArrayList<>(normalized.getBindings().size());
        for (Binding binding : normalized.getBindings()) {
            if (!isShortcode(binding.getMember())) {
                resolved.add(binding);
                continue;
            }
            ServiceIdentity identity = registry.identityFor(binding.getMember());
            Binding rewritten = binding.withMember(identity.getPrincipal());
            resolved.add(rewritten);
            recordDependency(identity, rewritten.getRole(), rewritten.getMember(), binding.getSource(), dependencies);
        }

        Map<String, Set<String>> resolvedPolicy = null;
        Optional<Map<String, Set<String>>> iamPolicy = normalized.getIamPolicy();
        if (iamPolicy.isPresent()) {
            resolvedPolicy = resolvePolicy(iamPolicy.get(), dependencies);
        }

        if (!dependencies.isEmpty()) {
            logger.atDebug().addKeyValue("dependencies", dependencies.size())
                    .log("Bindings waiting on service identity materialization");
        }
        NormalizedBindings rewritten = normalized.toBuilder()
                .bindings(Collections.unmodifiableList(resolved))
                .iamPolicy(resolvedPolicy)
                .build();
        return new ResolvedBindings(rewritten, Collections.unmodifiableList(new ArrayList<>(dependencies)));
    }

    private Map<String, Set<String>> resolvePolicy(Map<String, Set<String>> policy,
                                                   Set<IdentityDependency> dependencies)
            throws UnknownShortcodeException {
        Map<String, Set<String>> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : policy.entrySet()) {
            String role = entry.getKey();
            Set<String> members = new LinkedHashSet<>();
            for (String member : entry.getValue()) {
                if (!isShortcode(member)) {
                    members.add(member);
                    continue;
                }
                ServiceIdentity identity = registry.identityFor(member);
                members.add(identity.getPrincipal());
                recordDependency(identity, role, identity.getPrincipal(), BindingSource.IAM_POLICY, dependencies);
            }
            resolved.put(role, Collections.unmodifiableSet(members));
        }
        return Collections.unmodifiableMap(resolved);
    }

    private static void recordDependency(ServiceIdentity identity, String role, String member, BindingSource source,
                                         Set<IdentityDependency> dependencies) {
        if (!identity.isEager()) {
            return;
        }
        dependencies.add(IdentityDependency.builder()
                .role(role)
                .member(member)
                .source(source)
                .shortcode(identity.getShortcode())
                .service(identity.getService())
                .build());
    }
}
