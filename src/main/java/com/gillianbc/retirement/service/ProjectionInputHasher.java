package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.ProjectionInput;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 fingerprint of a projection input, equal for inputs that would project identically.
 */
@Component
public class ProjectionInputHasher {

    private final CanonicalJson canonicalJson;

    public ProjectionInputHasher() {
        this(new CanonicalJson());
    }

    @Autowired
    public ProjectionInputHasher(CanonicalJson canonicalJson) {
        this.canonicalJson = Objects.requireNonNull(canonicalJson, "canonicalJson must not be null");
    }

    /**
     * @return 64 lower-case hex characters
     */
    public String hash(ProjectionInput input) {
        String json = canonicalJson.write(canonicalJson.normalize(input));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
