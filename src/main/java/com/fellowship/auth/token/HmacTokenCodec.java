package com.fellowship.auth.token;

import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 基于 HMAC-SHA256 的令牌编解码实现。
 * <p>
 * 令牌由三段小写十六进制组成，以 {@code .} 分隔：
 * - 32 字节随机数；
 * - 签发时间（毫秒时间戳）；
 * - 对前两段文本的 HMAC，截断为 16 字节。
 * 密钥与最大有效期在构造时确定，之后只读，可被所有请求线程共享。
 */
public class HmacTokenCodec implements TokenCodec {

    private static final String ALGORITHM = "HmacSHA256";
    private static final int SECRET_BYTES = 32;
    private static final int SIGNATURE_BYTES = 16;
    private static final String DELIMITER = ".";
    private static final Pattern SECRET_PATTERN = Pattern.compile("[0-9a-f]{" + SECRET_BYTES * 2 + "}");
    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile("[0-9a-f]{1,15}");
    private static final Pattern SIGNATURE_PATTERN = Pattern.compile("[0-9a-f]{" + SIGNATURE_BYTES * 2 + "}");

    private final SecretKeySpec key;
    private final long maxAgeMillis;
    private final Clock clock;
    private final BytesKeyGenerator secretGenerator = KeyGenerators.secureRandom(SECRET_BYTES);

    public HmacTokenCodec(byte[] key, Duration maxAge, Clock clock) {
        if (key == null || key.length < 16) {
            throw new IllegalArgumentException("Token signing key must be at least 16 bytes");
        }
        this.key = new SecretKeySpec(key.clone(), ALGORITHM);
        this.maxAgeMillis = maxAge.toMillis();
        this.clock = clock;
    }

    @Override
    public String issue() {
        String secret = new String(Hex.encode(secretGenerator.generateKey()));
        String timestamp = Long.toHexString(clock.millis());
        return secret + DELIMITER + timestamp + DELIMITER + sign(secret, timestamp);
    }

    @Override
    public TokenStatus verify(String token) {
        if (token == null || token.isEmpty()) {
            return TokenStatus.MALFORMED;
        }
        String[] parts = token.split(Pattern.quote(DELIMITER), -1);
        if (parts.length != 3
                || !SECRET_PATTERN.matcher(parts[0]).matches()
                || !TIMESTAMP_PATTERN.matcher(parts[1]).matches()
                || !SIGNATURE_PATTERN.matcher(parts[2]).matches()) {
            return TokenStatus.MALFORMED;
        }
        byte[] expected = sign(parts[0], parts[1]).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = parts[2].getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, actual)) {
            return TokenStatus.FORGED;
        }
        long issuedAt = Long.parseLong(parts[1], 16);
        if (clock.millis() - issuedAt > maxAgeMillis) {
            return TokenStatus.EXPIRED;
        }
        return TokenStatus.VALID;
    }

    private String sign(String secret, String timestamp) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal((secret + DELIMITER + timestamp).getBytes(StandardCharsets.US_ASCII));
            byte[] truncated = new byte[SIGNATURE_BYTES];
            System.arraycopy(digest, 0, truncated, 0, SIGNATURE_BYTES);
            return new String(Hex.encode(truncated));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HmacSHA256 is not available", ex);
        }
    }
}
