package com.fellowship.auth.twofactor;

import org.apache.commons.codec.binary.Base32;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * RFC 6238 TOTP 计算（HmacSHA1）。
 * <p>
 * 密钥以无填充 Base32 形式存储与展示，验证器应用据此生成动态码。
 */
public class TotpGenerator {

    private static final String ALGORITHM = "HmacSHA1";
    private static final int SECRET_BYTES = 20;

    private final Duration period;
    private final int digits;
    private final int modulus;
    private final SecureRandom secureRandom = new SecureRandom();

    public TotpGenerator(Duration period, int digits) {
        if (digits < 6 || digits > 8) {
            throw new IllegalArgumentException("TOTP digits must be between 6 and 8");
        }
        this.period = period;
        this.digits = digits;
        this.modulus = (int) Math.pow(10, digits);
    }

    /** 生成 160 位随机密钥（Base32，无填充）。 */
    public String generateSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(bytes);
        return new Base32().encodeToString(bytes).replace("=", "");
    }

    /** 时间点所在的步号。 */
    public long stepAt(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), period.getSeconds());
    }

    /** 计算某一步的动态码（左侧补零到固定位数）。 */
    public String codeAt(String base32Secret, long step) {
        byte[] key = new Base32().decode(base32Secret.toUpperCase());
        byte[] counter = ByteBuffer.allocate(Long.BYTES).putLong(step).array();
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            byte[] hash = mac.doFinal(counter);
            int offset = hash[hash.length - 1] & 0x0f;
            int binary = ((hash[offset] & 0x7f) << 24)
                    | ((hash[offset + 1] & 0xff) << 16)
                    | ((hash[offset + 2] & 0xff) << 8)
                    | (hash[offset + 3] & 0xff);
            String code = Integer.toString(binary % modulus);
            return "0".repeat(digits - code.length()) + code;
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HmacSHA1 is not available", ex);
        }
    }

    /**
     * 在 {@code [current - skew, current + skew]} 范围内查找与输入匹配的步号。
     *
     * @param base32Secret 密钥。
     * @param code         用户输入。
     * @param now          当前时间。
     * @param skewSteps    允许偏移的步数。
     * @return 匹配的步号；不匹配时为空。
     */
    public OptionalLong matchStep(String base32Secret, String code, Instant now, int skewSteps) {
        if (code == null || code.length() != digits || !code.chars().allMatch(Character::isDigit)) {
            return OptionalLong.empty();
        }
        long current = stepAt(now);
        byte[] input = code.getBytes(StandardCharsets.US_ASCII);
        for (long step = current - skewSteps; step <= current + skewSteps; step++) {
            byte[] expected = codeAt(base32Secret, step).getBytes(StandardCharsets.US_ASCII);
            if (MessageDigest.isEqual(expected, input)) {
                return OptionalLong.of(step);
            }
        }
        return OptionalLong.empty();
    }

    /**
     * 生成验证器应用使用的 {@code otpauth://} 地址。
     */
    public String provisioningUri(String issuer, String accountName, String base32Secret) {
        String label = encode(issuer) + ":" + encode(accountName);
        return "otpauth://totp/" + label
                + "?secret=" + base32Secret
                + "&issuer=" + encode(issuer)
                + "&algorithm=SHA1"
                + "&digits=" + digits
                + "&period=" + period.getSeconds();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
