package com.techStack.accessSys.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.techStack.accessSys.models.principal.AccessRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * SHA-256 over the canonical JSON of everything a condition can read besides the
 * principal and resource identity: the request context, the resource attributes
 * and the principal's branch and service-account flag.
 */
@Slf4j
@Component
public class ContextFingerprint {

    private final ObjectMapper canonicalMapper;

    public ContextFingerprint(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @return empty when the context cannot be serialised; such requests bypass the cache
     */
    public Optional<String> of(AccessRequest request) {
        Map<String, Object> material = new TreeMap<>();
        material.put("context", request.getContext() == null ? Map.of() : request.getContext());
        material.put("attributes", request.getResource().getAttributes() == null
                ? Map.of() : request.getResource().getAttributes());
        material.put("branchId", request.getPrincipal().getBranchId() == null
                ? "" : request.getPrincipal().getBranchId());
        material.put("serviceAccount", request.getPrincipal().isServiceAccount());
        material.put("resourcePath", request.getResource().getPath() == null ? "" : request.getResource().getPath());
        material.put("resourceId", request.getResource().getId() == null ? "" : request.getResource().getId());

        try {
            byte[] json = canonicalMapper.writeValueAsBytes(material);
            return Optional.of(HexFormat.of().formatHex(sha256().digest(json)));
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Context of principal {} is not serialisable, bypassing cache: {}",
                    request.getPrincipal().getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
