/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.orgpolicy;

import com.cloudgov.governance.exceptions.ReconciliationException;
import com.cloudgov.governance.orgpolicy.model.OrgPolicy;
import com.cloudgov.governance.orgpolicy.model.PolicyRule;
import com.cloudgov.governance.orgpolicy.model.RuleValues;
import com.cloudgov.governance.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Combines file-loaded and inline org policies. An inline policy replaces the file-loaded policy for the same
 * constraint as a whole: no field of the file-loaded policy survives. Constraints only present in the file-loaded map
 * pass through unchanged.
 */
public class OrgPolicyMerger {
    private static final Logger logger = LoggerFactory.getLogger(OrgPolicyMerger.class);

    private final OrgPolicyValidator validator;

    public OrgPolicyMerger() {
        this(new OrgPolicyValidator());
    }

    public OrgPolicyMerger(OrgPolicyValidator validator) {
        this.validator = validator;
    }

    /**
     * Merge both sources after validating every policy in them.
     *
     * @param fileLoaded policies loaded from files, keyed by constraint name; may be null
     * @param inline     policies declared inline, keyed by constraint name; may be null
     * @return effective policies keyed by constraint name, each carrying its name
     * @throws ReconciliationException if a policy is invalid or declares a name different from its key
     */
    public SortedMap<String, OrgPolicy> merge(Map<String, OrgPolicy> fileLoaded, Map<String, OrgPolicy> inline)
            throws ReconciliationException {
        Map<String, OrgPolicy> fileMap = Utils.nullEmpty(fileLoaded);
        Map<String, OrgPolicy> inlineMap = Utils.nullEmpty(inline);

        SortedMap<String, OrgPolicy> merged = new TreeMap<>();
        for (Map.Entry<String, OrgPolicy> entry : fileMap.entrySet()) {
            validator.validate(entry.getKey(), entry.getValue());
            merged.put(entry.getKey(), canonical(entry.getKey(), entry.getValue()));
        }
        int replaced = 0;
        for (Map.Entry<String, OrgPolicy> entry : inlineMap.entrySet()) {
            validator.validate(entry.getKey(), entry.getValue());
            if (merged.put(entry.getKey(), canonical(entry.getKey(), entry.getValue())) != null) {
                replaced++;
                logger.atDebug().addKeyValue("constraint", entry.getKey())
                        .log("Inline org policy replaces the file-loaded one");
            }
        }
        logger.atInfo().addKeyValue("fileLoaded", fileMap.size()).addKeyValue("inline", inlineMap.size())
                .addKeyValue("replaced", replaced).addKeyValue("effective", merged.size())
                .log("Merged org policies");
        return Collections.unmodifiableSortedMap(merged);
    }

    // fills in the name from the key and copies every rule, so the result shares no collection with the input
    private static OrgPolicy canonical(String key, OrgPolicy policy) {
        if (policy == null) {
            return OrgPolicy.builder().name(key).build();
        }
        List<PolicyRule> rules = new ArrayList<>();
        for (PolicyRule rule : Utils.nullEmpty(policy.getRules())) {
            rules.add(rule.toBuilder().allow(frozen(rule.getAllow())).deny(frozen(rule.getDeny())).build());
        }
        return policy.toBuilder().name(key).rules(Collections.unmodifiableList(rules)).build();
    }

    private static RuleValues frozen(RuleValues values) {
        if (values == null || values.getValues() == null) {
            return values;
        }
        return values.toBuilder()
                .values(Collections.unmodifiableSet(new LinkedHashSet<>(values.getValues())))
                .build();
    }
}
