package com.github.dimitryivaniuta.outreach.passes.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;
import com.github.dimitryivaniuta.outreach.passes.service.dto.JobMetadata;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of the job's text columns: {@code metadata_json}, {@code wallet_pass_url} and
 * {@code wallet_pass_errors}.
 *
 * <p>Reading is lenient for every column: unknown keys and platforms are ignored and a value that is not a JSON
 * object reads as empty. Metadata is written by other services, and rows created before the wallet columns held
 * JSON carry a plain URL there; one such row must not break claiming or listing of the others.</p>
 */
@Component
public class JobMetadataCodec {

    private static final Logger log = LoggerFactory.getLogger(JobMetadataCodec.class);

    static final String REQUESTED_PLATFORMS = "requested_platforms";
    static final String SOURCE = "source";

    private final ObjectMapper objectMapper;

    public JobMetadataCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String writeMetadata(JobMetadata metadata) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode platforms = root.putArray(REQUESTED_PLATFORMS);
        metadata.requestedPlatforms().stream().distinct().forEach(p -> platforms.add(p.key()));
        if (metadata.source() != null) {
            root.put(SOURCE, metadata.source());
        }
        return write(root);
    }

    public JobMetadata readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return JobMetadata.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unparsable job metadata: {}", e.getOriginalMessage());
            return JobMetadata.empty();
        }
        if (root == null || !root.isObject()) {
            return JobMetadata.empty();
        }

        List<WalletPlatform> platforms = new ArrayList<>();
        JsonNode requested = root.path(REQUESTED_PLATFORMS);
        if (requested.isArray()) {
            for (JsonNode n : requested) {
                WalletPlatform.fromKey(n.asText()).ifPresentOrElse(
                        p -> {
                            if (!platforms.contains(p)) {
                                platforms.add(p);
                            }
                        },
                        () -> log.debug("Ignoring unknown wallet platform '{}'", n.asText()));
            }
        }
        JsonNode source = root.get(SOURCE);
        return new JobMetadata(platforms, source != null && source.isTextual() ? source.asText() : null);
    }

    /**
     * @param json JSON object keyed by platform key, may be null
     * @return map in platform order, empty for null or anything that is not a JSON object
     */
    public Map<WalletPlatform, String> readPlatformMap(String json) {
        Map<WalletPlatform, String> result = new EnumMap<>(WalletPlatform.class);
        if (json == null || json.isBlank()) {
            return result;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed wallet pass map: {}", e.getOriginalMessage());
            return result;
        }
        if (root == null || !root.isObject()) {
            log.warn("Ignoring wallet pass value that is not a platform map: {}", Failures.truncate(json));
            return result;
        }
        root.fields().forEachRemaining(e -> {
            if (e.getValue().isTextual()) {
                WalletPlatform.fromKey(e.getKey()).ifPresent(p -> result.put(p, e.getValue().asText()));
            }
        });
        return result;
    }

    /**
     * @param values values per platform
     * @return JSON object keyed by platform key, or null when empty
     */
    public String writePlatformMap(Map<WalletPlatform, String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        Map<String, String> byKey = new LinkedHashMap<>();
        new EnumMap<>(values).forEach((p, v) -> byKey.put(p.key(), v));
        return write(byKey);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize job JSON", e);
        }
    }
}
