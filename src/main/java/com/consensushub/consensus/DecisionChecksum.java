package com.consensushub.consensus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * SHA-256 content hash of a final decision, used to detect tampering once
 * the decision has been delivered to the participating nodes.
 * The hash covers the compact JSON form in map insertion order.
 */
public final class DecisionChecksum {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private DecisionChecksum() {
    }

    public static String of(Map<String, Object> finalDecision) {
        try {
            byte[] json = objectMapper.writeValueAsString(finalDecision).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("final decision is not serializable: " + ex.getOriginalMessage(), ex);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    public static boolean verify(Map<String, Object> finalDecision, String claimedChecksum) {
        return claimedChecksum != null && MessageDigest.isEqual(
            of(finalDecision).getBytes(StandardCharsets.US_ASCII),
            claimedChecksum.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
    }
}
