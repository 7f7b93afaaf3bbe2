package com.fellowship.auth.headers;

import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;

import java.util.Base64;

/**
 * CSP nonce 生成器：每个请求 16 字节随机数，Base64 编码。
 */
public class NonceGenerator {

    private static final int NONCE_BYTES = 16;

    private final BytesKeyGenerator generator = KeyGenerators.secureRandom(NONCE_BYTES);

    public String next() {
        return Base64.getEncoder().encodeToString(generator.generateKey());
    }
}
