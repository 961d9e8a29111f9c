package com.github.dimitryivaniuta.outreach.passes.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.outreach.passes.service.dto.TenantIssuanceSettings;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.cache.interceptor.LoggingCacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Cache configuration.
 *
 * <p>Redis caches tenant issuance settings only; Postgres is the source of truth. With
 * {@code spring.cache.type=none} this manager is not created and Spring Boot falls back to a no-op cache.
 * Cache errors are logged and the lookup falls through to the database.</p>
 */
@EnableCaching
@Configuration
public class CacheConfig implements CachingConfigurer {

    /**
     * Cache name for per-tenant issuance settings.
     */
    public static final String TENANT_SETTINGS_CACHE = "tenantIssuanceSettings";

    /**
     * Cache manager using Redis with JSON serialization.
     *
     * @param factory      redis connection factory
     * @param objectMapper object mapper used for JSON serialization
     * @param properties   app properties (TTL)
     * @return cache manager
     */
    @Bean
    @ConditionalOnProperty(name = "spring.cache.type", havingValue = "redis", matchIfMissing = true)
    public RedisCacheManager cacheManager(RedisConnectionFactory factory, ObjectMapper objectMapper, AppProperties properties) {
        var settingsSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, TenantIssuanceSettings.class);

        var defaultCfg = RedisCacheConfiguration.defaultCacheConfig()
                .prefixCacheNameWith("passes:")
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()));

        var settingsCfg = defaultCfg
                .entryTtl(properties.getIssuance().getTenantSettingsTtl())
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(settingsSerializer));

        return RedisCacheManager.builder(factory)
                .cacheDefaults(defaultCfg)
                .withCacheConfiguration(TENANT_SETTINGS_CACHE, settingsCfg)
                .build();
    }

    @Override
    public CacheErrorHandler errorHandler() {
        return new LoggingCacheErrorHandler();
    }
}
