package com.vaultsphere.auth.domain.service;

import com.vaultsphere.auth.domain.utils.CryptoUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base32;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;

import static com.vaultsphere.auth.domain.constants.AuthConstants.*;

/**
 * TOTP Service - RFC 6238 time-based one-time codes
 * HMAC-SHA1, 6 digits, 30 second steps, base32 secrets
 */
@Service
@Slf4j
public class TotpService {

    private static final Pattern CODE_PATTERN = Pattern.compile("^\\d{" + TOTP_DIGITS + "}$");
    private static final int[] DIGITS_POWER = {1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000, 100_000_000};

    private final CryptoUtils cryptoUtils;
    private final Clock clock;
    private final Base32 base32 = new Base32();

    public TotpService(CryptoUtils cryptoUtils, Clock clock) {
        this.cryptoUtils = cryptoUtils;
        this.clock = clock;
    }

    /**
     * Generate a fresh 160-bit secret, base32 without padding
     */
    public String generateSecret() {
        byte[] key = cryptoUtils.randomBytes(TOTP_SECRET_BYTES);
        return base32.encodeToString(key).replace("=", "");
    }

    /**
     * Build the otpauth:// URI authenticator apps read from a QR code
     */
    public String provisioningUri(String accountEmail, String secret) {
        String label = urlEncode(TOTP_ISSUER + ":" + accountEmail);
        return "otpauth://totp/" + label
                + "?secret=" + secret
                + "&issuer=" + urlEncode(TOTP_ISSUER)
                + "&algorithm=SHA1"
                + "&digits=" + TOTP_DIGITS
                + "&period=" + TOTP_PERIOD_SECONDS;
    }

    public boolean verify(String secret, String code) {
        return verify(secret, code, clock.instant());
    }

    /**
     * Accepts codes from {@code TOTP_DRIFT_WINDOW} steps either side of {@code at}.
     * Every candidate in the window is compared so timing does not reveal which step matched.
     */
    public boolean verify(String secret, String code, Instant at) {
        if (secret == null || code == null || !CODE_PATTERN.matcher(code).matches()) {
            return false;
        }

        byte[] key = decodeSecret(secret);
        long currentStep = timeStep(at);
        boolean matched = false;
        for (int offset = -TOTP_DRIFT_WINDOW; offset <= TOTP_DRIFT_WINDOW; offset++) {
            String candidate = generateCode(key, currentStep + offset);
            matched |= cryptoUtils.slowEquals(code, candidate);
        }

        log.debug("[TOTP_VERIFY] TOTP verification result | matched={}", matched);
        return matched;
    }

    /**
     * Code an authenticator app shows at {@code at}
     */
    public String generateCode(String secret, Instant at) {
        return generateCode(decodeSecret(secret), timeStep(at));
    }

    private long timeStep(Instant at) {
        return Math.floorDiv(at.getEpochSecond(), TOTP_PERIOD_SECONDS);
    }

    private byte[] decodeSecret(String secret) {
        String normalized = secret.replace(" ", "").toUpperCase(Locale.ROOT);
        byte[] key = base32.decode(normalized);
        if (key.length == 0) {
            throw new IllegalArgumentException("TOTP secret is not valid base32");
        }
        return key;
    }

    private String generateCode(byte[] key, long step) {
        try {
            Mac mac = Mac.getInstance(TOTP_ALGORITHM);
            mac.init(new SecretKeySpec(key, TOTP_ALGORITHM));
            byte[] hash = mac.doFinal(ByteBuffer.allocate(Long.BYTES).putLong(step).array());

            // dynamic truncation, RFC 4226 section 5.3
            int offset = hash[hash.length - 1] & 0x0f;
            int binary = ((hash[offset] & 0x7f) << 24)
                    | ((hash[offset + 1] & 0xff) << 16)
                    | ((hash[offset + 2] & 0xff) << 8)
                    | (hash[offset + 3] & 0xff);

            int otp = binary % DIGITS_POWER[TOTP_DIGITS];
            return String.format("%0" + TOTP_DIGITS + "d", otp);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 not available", e);
        }
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
