package com.geomonitor.gatewayservice.services.credentials;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Generates API key tokens of the form {@code <prefix>-<suffix>}: 8 hex chars
 * of display prefix and 32 hex chars of secret suffix, 160 random bits in total.
 */
@Component
public class TokenGenerator {

    private static final int PREFIX_BYTES = 4;
    private static final int SUFFIX_BYTES = 16;

    private final SecureRandom random = new SecureRandom();

    public GeneratedToken generate() {
        String prefix = randomHex(PREFIX_BYTES);
        String suffix = randomHex(SUFFIX_BYTES);
        return new GeneratedToken(prefix + "-" + suffix, prefix);
    }

    private String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        random.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }

    public record GeneratedToken(String token, String prefix) {

        @Override
        public String toString() {
            return "GeneratedToken[prefix=" + prefix + "]";
        }
    }
}
