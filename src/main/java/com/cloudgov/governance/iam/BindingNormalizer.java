/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.iam;

import com.cloudgov.governance.iam.model.Binding;
import com.cloudgov.governance.iam.model.BindingSource;
import com.cloudgov.governance.iam.model.IamInputs;
import com.cloudgov.governance.iam.model.NormalizedBindings;
import com.cloudgov.governance.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Converts the five IAM input shapes into canonical (role, member, source) bindings. Pure function of its input.
 */
public class BindingNormalizer {
    public static final String GROUP_PRINCIPAL_PREFIX = "group:";
    private static final Logger logger = LoggerFactory.getLogger(BindingNormalizer.class);

    /**
     * Expand every input shape into bindings. No deduplication happens here.
     *
     * @param inputs parsed IAM inputs
     * @return normalized bindings, never null
     */
    public NormalizedBindings normalize(IamInputs inputs) {
        List<Binding> bindings = new ArrayList<>();
        Set<String> declaredAuthoritativeRoles = new TreeSet<>();
        Set<BindingSource> declaredSources = EnumSet.noneOf(BindingSource.class);

        // group_iam is keyed by group, each group is bound to every listed role
        Map<String, List<String>> groupIam = Utils.nullEmpty(inputs.getGroupIam());
        if (!groupIam.isEmpty()) {
            declaredSources.add(BindingSource.GROUP);
        }
        for (Map.Entry<String, List<String>> entry : groupIam.entrySet()) {
            String member = groupPrincipal(entry.getKey());
            for (String role : Utils.nullEmpty(entry.getValue())) {
                bindings.add(Binding.of(role, member, BindingSource.GROUP));
                declaredAuthoritativeRoles.add(role);
            }
        }

        expandRoleKeyed(inputs.getIam(), BindingSource.ROLE_AUTHORITATIVE, bindings, declaredSources,
                declaredAuthoritativeRoles);
        expandRoleKeyed(inputs.getIamAdditive(), BindingSource.ROLE_ADDITIVE, bindings, declaredSources,
                declaredAuthoritativeRoles);

        Map<String, List<String>> memberKeyed = Utils.nullEmpty(inputs.getIamAdditiveMembers());
        if (!memberKeyed.isEmpty()) {
            declaredSources.add(BindingSource.MEMBER_ADDITIVE);
        }
        for (Map.Entry<String, List<String>> entry : memberKeyed.entrySet()) {
            for (String role : Utils.nullEmpty(entry.getValue())) {
                bindings.add(Binding.of(role, entry.getKey(), BindingSource.MEMBER_ADDITIVE));
            }
        }

        Map<String, Set<String>> iamPolicy =
                inputs.getIamPolicy() == null ? null : Utils.immutableMultimap(inputs.getIamPolicy());

        logger.atDebug().addKeyValue("bindings", bindings.size()).addKeyValue("sources", declaredSources)
                .addKeyValue("iamPolicy", iamPolicy != null).log("Normalized IAM inputs");
        return NormalizedBindings.builder()
                .bindings(Collections.unmodifiableList(bindings))
                .declaredAuthoritativeRoles(Collections.unmodifiableSet(declaredAuthoritativeRoles))
                .declaredSources(Collections.unmodifiableSet(declaredSources))
                .iamPolicy(iamPolicy)
                .build();
    }

    private static void expandRoleKeyed(Map<String, List<String>> roleKeyed, BindingSource source,
                                        List<Binding> bindings, Set<BindingSource> declaredSources,
                                        Set<String> declaredAuthoritativeRoles) {
        if (Utils.isEmpty(roleKeyed)) {
            return;
        }
        declaredSources.add(source);
        for (Map.Entry<String, List<String>> entry : roleKeyed.entrySet()) {
            String role = entry.getKey();
            if (source.isAuthoritative()) {
                declaredAuthoritativeRoles.add(role);
            }
            for (String member : Utils.nullEmpty(entry.getValue())) {
                bindings.add(Binding.of(role, member, source));
            }
        }
    }

    static String groupPrincipal(String group) {
        return group.startsWith(GROUP_PRINCIPAL_PREFIX) ? group : GROUP_PRINCIPAL_PREFIX + group;
    }
}
