package com.fellowship.auth.config;

import com.fellowship.auth.session.InMemorySessionStore;
import com.fellowship.auth.session.RedisSessionStore;
import com.fellowship.auth.session.SessionStore;
import com.fellowship.auth.twofactor.InMemoryTwoFactorStore;
import com.fellowship.auth.twofactor.RedisTwoFactorStore;
import com.fellowship.auth.twofactor.TwoFactorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * 会话与二次验证存储的装配。
 * <p>
 * - {@code auth.store.type=redis}（默认）：基于 {@link StringRedisTemplate}；
 * - {@code auth.store.type=memory}：进程内存储，仅用于本地开发与测试。
 */
@Slf4j
@Configuration
public class AuthStoreConfiguration {

    @Configuration
    @ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "redis", matchIfMissing = true)
    static class RedisStores {

        @Bean
        public SessionStore sessionStore(StringRedisTemplate redisTemplate) {
            return new RedisSessionStore(redisTemplate);
        }

        @Bean
        public TwoFactorStore twoFactorStore(StringRedisTemplate redisTemplate) {
            return new RedisTwoFactorStore(redisTemplate);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "memory")
    static class InMemoryStores {

        @Bean
        public SessionStore sessionStore() {
            log.warn("Using in-memory session store, sessions are lost on restart");
            return new InMemorySessionStore();
        }

        @Bean
        public TwoFactorStore twoFactorStore(Clock clock) {
            return new InMemoryTwoFactorStore(clock);
        }
    }
}
