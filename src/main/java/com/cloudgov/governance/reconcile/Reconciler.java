/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.reconcile;

import com.cloudgov.governance.exceptions.ReconciliationException;
import com.cloudgov.governance.iam.BindingMerger;
import com.cloudgov.governance.iam.BindingNormalizer;
import com.cloudgov.governance.iam.ExclusivityValidator;
import com.cloudgov.governance.iam.model.BindingOperationSet;
import com.cloudgov.governance.iam.model.NormalizedBindings;
import com.cloudgov.governance.identity.ResolvedBindings;
import com.cloudgov.governance.identity.ServiceIdentity;
import com.cloudgov.governance.identity.ServiceIdentityRegistry;
import com.cloudgov.governance.identity.ShortcodeResolver;
import com.cloudgov.governance.identity.ShortcodeTable;
import com.cloudgov.governance.orgpolicy.OrgPolicyMerger;
import com.cloudgov.governance.orgpolicy.model.OrgPolicy;
import com.cloudgov.governance.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Runs one reconciliation pass: IAM normalization, exclusivity validation, shortcode resolution and merging, then
 * the org policy merge, and finally the apply plan. Either the whole result is returned or the first error is thrown;
 * nothing partial is ever produced.
 */
public class Reconciler {
    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    private final ShortcodeTable shortcodeTable;
    private final BindingNormalizer normalizer;
    private final ExclusivityValidator exclusivityValidator;
    private final BindingMerger bindingMerger;
    private final OrgPolicyMerger orgPolicyMerger;
    private final ApplyPlanner applyPlanner;

    public Reconciler() {
        this(ShortcodeTable.loadDefault());
    }

    public Reconciler(ShortcodeTable shortcodeTable) {
        this(shortcodeTable, new BindingNormalizer(), new ExclusivityValidator(), new BindingMerger(),
                new OrgPolicyMerger(), new ApplyPlanner());
    }

    /**
     * Constructor for injecting collaborators.
     *
     * @param shortcodeTable       static service identity table
     * @param normalizer           IAM input normalizer
     * @param exclusivityValidator IAM mode validator
     * @param bindingMerger        IAM binding merger
     * @param orgPolicyMerger      org policy merger
     * @param applyPlanner         apply plan builder
     */
    public Reconciler(ShortcodeTable shortcodeTable, BindingNormalizer normalizer,
                      ExclusivityValidator exclusivityValidator, BindingMerger bindingMerger,
                      OrgPolicyMerger orgPolicyMerger, ApplyPlanner applyPlanner) {
        this.shortcodeTable = shortcodeTable;
        this.normalizer = normalizer;
        this.exclusivityValidator = exclusivityValidator;
        this.bindingMerger = bindingMerger;
        this.orgPolicyMerger = orgPolicyMerger;
        this.applyPlanner = applyPlanner;
    }

    /**
     * Reconcile a request.
     *
     * @param request parsed inputs
     * @return the complete reconciled state
     * @throws ReconciliationException on the first configuration defect found
     */
    public ReconciliationResult reconcile(ReconciliationRequest request) throws ReconciliationException {
        ServiceIdentityRegistry registry = new ServiceIdentityRegistry(shortcodeTable, request.getContainerNumber());
        for (Map.Entry<String, String> entry : Utils.nullEmpty(request.getMaterializedPrincipals()).entrySet()) {
            registry.materialize(entry.getKey(), entry.getValue());
        }

        NormalizedBindings normalized = normalizer.normalize(request.getIam());
        exclusivityValidator.validate(normalized);
        ResolvedBindings resolved = new ShortcodeResolver(registry).resolve(normalized);
        BindingOperationSet bindings = bindingMerger.merge(resolved);

        SortedMap<String, OrgPolicy> orgPolicies =
                orgPolicyMerger.merge(request.getFileOrgPolicies(), request.getInlineOrgPolicies());

        List<ServiceIdentity> eagerIdentities = registry.eagerIdentities(request.getServices());
        ApplyPlan plan = applyPlanner.plan(request.getServices(), eagerIdentities, bindings, orgPolicies);

        logger.atInfo().addKeyValue("authoritativeRoles", bindings.getAuthoritative().size())
                .addKeyValue("additivePairs", bindings.getAdditive().size())
                .addKeyValue("iamPolicy", bindings.isFullPolicyMode())
                .addKeyValue("orgPolicies", orgPolicies.size())
                .addKeyValue("eagerIdentities", eagerIdentities.size())
                .addKeyValue("steps", plan.getSteps().size())
                .log("Reconciliation pass complete");
        return ReconciliationResult.builder()
                .bindings(bindings)
                .orgPolicies(orgPolicies)
                .eagerIdentities(eagerIdentities)
                .applyPlan(plan)
                .discovery(registry.discovery())
                .build();
    }
}
