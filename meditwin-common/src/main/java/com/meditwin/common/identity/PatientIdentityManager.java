package com.meditwin.common.identity;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Salted, one-way pseudonymization of caller identifiers.
 *
 * A caller identifier is turned into {@code PT_} followed by the first 16 upper-case hex digits of
 * HMAC-SHA256(salt, callerId). No reverse mapping is ever stored. Each storage backend applies a second
 * HMAC pass with its own salt so that keys cannot be correlated across backends.
 */
@Slf4j
@Component
public class PatientIdentityManager {

    public static final String PREFIX = "PT_";
    public static final int HASH_LENGTH = 16;
    public static final int ID_LENGTH = PREFIX.length() + HASH_LENGTH;

    static final String EMPTY_PLACEHOLDER = "EMPTY_PATIENT_ID";

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Pattern ID_PATTERN = Pattern.compile("^PT_[0-9A-F]{16}$");

    // Identifiers containing one of these are non-production and may be logged verbatim
    private static final List<String> TEST_PATTERNS = List.of(
            "PT_TEST", "PT_DEV", "PT_DEMO", "TEST_USER", "DEMO_USER");

    private final String salt;

    public PatientIdentityManager(@Value("${meditwin.identity.salt}") String salt) {
        if (salt == null || salt.isBlank()) {
            throw new IllegalStateException("meditwin.identity.salt must be configured");
        }
        this.salt = salt;
    }

    /**
     * Derive the patient identifier for a caller. Deterministic for a given salt.
     *
     * @throws InvalidCallerIdException if the caller identifier is null or blank
     */
    public String deriveId(String callerId) {
        if (callerId == null || callerId.isBlank()) {
            throw new InvalidCallerIdException("Caller identifier is required");
        }
        String digest = hmacHex(salt, callerId);
        return PREFIX + digest.substring(0, HASH_LENGTH).toUpperCase(Locale.ROOT);
    }

    public boolean validateFormat(String patientId) {
        return patientId != null && ID_PATTERN.matcher(patientId).matches();
    }

    public boolean isTestIdentifier(String patientId) {
        if (patientId == null) {
            return false;
        }
        String upper = patientId.toUpperCase(Locale.ROOT);
        return TEST_PATTERNS.stream().anyMatch(upper::contains);
    }

    /** Log-safe rendering: prefix plus length only */
    public String anonymizeForLog(String patientId) {
        if (patientId == null || patientId.isEmpty()) {
            return EMPTY_PLACEHOLDER;
        }
        if (isTestIdentifier(patientId)) {
            return patientId;
        }
        return PREFIX + "***[" + patientId.length() + "]";
    }

    /**
     * Second HMAC pass keyed by a backend-specific salt. Falls back to the process salt when the store
     * salt is blank.
     */
    public String rehashForStore(String patientId, String storeSalt) {
        if (patientId == null || patientId.isBlank()) {
            throw new InvalidCallerIdException("Patient identifier is required");
        }
        String key = (storeSalt == null || storeSalt.isBlank()) ? salt : storeSalt;
        return hmacHex(key, patientId);
    }

    private static String hmacHex(String key, String value) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            // HmacSHA256 is a mandatory JCA algorithm
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
