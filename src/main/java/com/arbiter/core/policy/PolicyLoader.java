package com.arbiter.core.policy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Reads the capability dictionary and decision boundary spec from versioned
 * YAML or JSON documents and fingerprints their canonical form.
 * <p>
 * The format is chosen by file extension: {@code .json} is parsed as JSON,
 * anything else as YAML. Unknown properties are rejected so that a typo in a
 * policy document fails startup instead of silently relaxing a constraint.
 */
public class PolicyLoader {

    private static final Logger log = LoggerFactory.getLogger(PolicyLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper canonicalMapper;

    public PolicyLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        this.yamlMapper = YAMLMapper.builder(new YAMLFactory())
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        this.jsonMapper = JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        this.canonicalMapper = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    public CapabilityDictionary loadDictionary(String location) {
        CapabilityDictionary dictionary = read(location, CapabilityDictionary.class);
        log.info("Loaded capability dictionary {} from {} ({} fields, {} actions)",
                dictionary.version(), location, dictionary.fields().size(), dictionary.actions().size());
        return dictionary;
    }

    public DecisionBoundarySpec loadBoundaries(String location) {
        DecisionBoundarySpec spec = read(location, DecisionBoundarySpec.class);
        log.info("Loaded decision boundary spec {} from {} ({} rules)",
                spec.version(), location, spec.rules().size());
        return spec;
    }

    /**
     * Loads both documents and assembles the policy handle.
     */
    public GovernancePolicy load(String dictionaryLocation, String boundariesLocation) {
        CapabilityDictionary dictionary = loadDictionary(dictionaryLocation);
        DecisionBoundarySpec boundaries = loadBoundaries(boundariesLocation);
        return new GovernancePolicy(dictionary, boundaries, fingerprint(dictionary), fingerprint(boundaries));
    }

    /**
     * Builds a policy handle from already constructed policies.
     */
    public GovernancePolicy assemble(CapabilityDictionary dictionary, DecisionBoundarySpec boundaries) {
        return new GovernancePolicy(dictionary, boundaries, fingerprint(dictionary), fingerprint(boundaries));
    }

    /**
     * SHA-256 over the canonical (sorted-key) JSON form of a policy object.
     */
    public String fingerprint(Object policy) {
        try {
            byte[] canonical = canonicalMapper.writeValueAsBytes(policy);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            return HexFormat.of().formatHex(digest);
        } catch (IOException e) {
            throw new PolicyLoadException("Unable to serialize policy for fingerprinting", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private <T> T read(String location, Class<T> type) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new PolicyLoadException("Policy document not found: " + location);
        }
        ObjectMapper mapper = location.endsWith(".json") ? jsonMapper : yamlMapper;
        try (InputStream in = resource.getInputStream()) {
            return mapper.readValue(in, type);
        } catch (IOException | IllegalArgumentException e) {
            throw new PolicyLoadException("Malformed policy document " + location + ": " + e.getMessage(), e);
        }
    }
}
