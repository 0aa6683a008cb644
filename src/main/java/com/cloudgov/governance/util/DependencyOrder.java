/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

public class DependencyOrder<T> {
    private static final Logger logger = LoggerFactory.getLogger(DependencyOrder.class);

    @FunctionalInterface
    public interface DependencyGetter<T> {
        Set<T> getDependencies(T elem);
    }

    /**
     * Resolve the inter-dependency order within a given set of elements. Elements whose dependencies are all
     * satisfied keep the iteration order of the input, so a sorted input yields a deterministic order.
     * The input set is not modified.
     *
     * @param elements a set of inter-dependent elements
     * @param dependencyGetter function to get all dependency elements of the given element
     * @return unique dependency order
     */
    @SuppressWarnings("PMD.LooseCoupling")
    public LinkedHashSet<T> computeOrderedDependencies(Set<T> elements, DependencyGetter<T> dependencyGetter) {
        final Set<T> pendingDependencies = new LinkedHashSet<>(elements);
        final LinkedHashSet<T> dependencyFound = new LinkedHashSet<>();
        while (!pendingDependencies.isEmpty()) {
            int sz = pendingDependencies.size();
            pendingDependencies.removeIf(pending -> {
                if (dependencyFound.containsAll(dependencyGetter.getDependencies(pending))) {
                    dependencyFound.add(pending);
                    return true;
                }
                return false;
            });
            if (sz == pendingDependencies.size()) {
                // didn't find anything to remove, there must be a cycle or a dependency outside the set
                logger.atError().addKeyValue("pendingItems", pendingDependencies)
                        .log("Found unsatisfiable or circular dependencies. Ignoring all pending items");
                break;
            }
        }
        return dependencyFound;
    }
}
