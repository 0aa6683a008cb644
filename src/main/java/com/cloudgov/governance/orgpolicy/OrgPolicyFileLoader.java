/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.orgpolicy;

import com.cloudgov.governance.orgpolicy.exceptions.DuplicatePolicyKeyException;
import com.cloudgov.governance.orgpolicy.model.OrgPolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads org policies from a directory of YAML files. Every file maps constraint names to policy bodies:
 * <pre>
 * compute.disableGuestAttributesAccess:
 *   rules:
 *     - enforce: true
 * iam.allowedPolicyMemberDomains:
 *   inherit_from_parent: false
 *   rules:
 *     - allow:
 *         values:
 *           - C0xxxxxxx
 *       condition:
 *         expression: resource.matchTag('1234/env', 'prod')
 *         title: prod only
 * </pre>
 * Files are read in name order and the directory is not searched recursively.
 */
public final class OrgPolicyFileLoader {
    private static final Logger logger = LoggerFactory.getLogger(OrgPolicyFileLoader.class);
    private static final ObjectMapper YAML_MAPPER =
            YAMLMapper.builder().configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, true).build();
    private static final TypeReference<LinkedHashMap<String, OrgPolicy>> POLICY_MAP_TYPE =
            new TypeReference<LinkedHashMap<String, OrgPolicy>>() {
            };

    /**
     * Load every YAML file of a directory. Never returns null; a missing directory yields an empty map.
     *
     * @param directory directory holding the policy files
     * @return policies keyed by constraint name
     * @throws IOException                 if a file cannot be read or parsed
     * @throws DuplicatePolicyKeyException if two files declare the same constraint
     */
    public SortedMap<String, OrgPolicy> loadDirectory(Path directory) throws IOException, DuplicatePolicyKeyException {
        SortedMap<String, OrgPolicy> policies = new TreeMap<>();
        if (!Files.isDirectory(directory)) {
            logger.atInfo().addKeyValue("path", directory).log("Org policy directory not found, no policies loaded");
            return Collections.unmodifiableSortedMap(policies);
        }

        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries.filter(Files::isRegularFile).filter(OrgPolicyFileLoader::isYamlFile).sorted()
                    .collect(Collectors.toList());
        }

        Map<String, Path> origins = new HashMap<>();
        for (Path file : files) {
            Map<String, OrgPolicy> filePolicies = loadFile(file);
            for (Map.Entry<String, OrgPolicy> entry : filePolicies.entrySet()) {
                Path previous = origins.putIfAbsent(entry.getKey(), file);
                if (previous != null) {
                    throw new DuplicatePolicyKeyException(String.format("Org policy %s is defined in both %s and %s",
                            entry.getKey(), previous.getFileName(), file.getFileName()), entry.getKey());
                }
                policies.put(entry.getKey(), entry.getValue());
            }
            logger.atDebug().addKeyValue("file", file.getFileName()).addKeyValue("policies", filePolicies.size())
                    .log("Loaded org policy file");
        }
        logger.atInfo().addKeyValue("path", directory).addKeyValue("files", files.size())
                .addKeyValue("policies", policies.size()).log("Loaded org policies from directory");
        return Collections.unmodifiableSortedMap(policies);
    }

    /**
     * Load a single YAML file.
     *
     * @param file policy file
     * @return policies keyed by constraint name, in file order; a constraint with an empty body maps to null
     * @throws IOException if the file cannot be read or parsed
     */
    public Map<String, OrgPolicy> loadFile(Path file) throws IOException {
        try (InputStream inputStream = Files.newInputStream(file)) {
            return load(inputStream);
        } catch (IOException e) {
            throw new IOException("Unable to load org policy file " + file, e);
        }
    }

    /**
     * Parse policies from a YAML stream.
     *
     * @param inputStream stream to parse, not closed
     * @return policies keyed by constraint name, in document order
     * @throws IOException if the stream cannot be parsed into policies
     */
    public Map<String, OrgPolicy> load(InputStream inputStream) throws IOException {
        JsonNode root = YAML_MAPPER.readTree(inputStream);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Collections.emptyMap();
        }
        if (!root.isObject()) {
            throw new IOException("Org policy document must be a map of constraint names to policies");
        }
        try {
            return Collections.unmodifiableMap(YAML_MAPPER.convertValue(root, POLICY_MAP_TYPE));
        } catch (IllegalArgumentException e) {
            throw new IOException("Unable to deserialize org policies", e);
        }
    }

    @SuppressFBWarnings(value = "NP_NULL_ON_SOME_PATH_FROM_RETURN_VALUE",
            justification = "Entries listed from a directory always have a file name")
    private static boolean isYamlFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
