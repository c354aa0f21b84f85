package io.pixmarket.commerce.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.pixmarket.commerce.application.cart.dto.CartResponse;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.cache.interceptor.SimpleCacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Spring Cache 설정 (Redis 기반)
 *
 * 캐시 대상은 장바구니 조회(carts)뿐이다.
 * - 장바구니 담기/삭제, 구매 완료(장바구니 삭제) 시 @CacheEvict
 * - 구매 여부(has_purchased), 결제 상태는 캐시하지 않는다
 *
 * Note: 테스트 환경에서는 비활성화 (@Profile("!test"))
 */
@Configuration
@EnableCaching
@Profile("!test")
public class CacheConfig {

    public static final String CARTS = "carts";

    private ObjectMapper cartObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private RedisCacheConfiguration cartCacheConfig() {
        return RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(Duration.ofMinutes(10))  // 카탈로그 가격 변경이 늦게 반영되는 상한
                .serializeKeysWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                                new StringRedisSerializer()
                        )
                )
                .serializeValuesWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                                new Jackson2JsonRedisSerializer<>(cartObjectMapper(), CartResponse.class)
                        )
                )
                .disableCachingNullValues();
    }

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(cartCacheConfig())
                .withCacheConfiguration(CARTS, cartCacheConfig())
                .transactionAware()  // 트랜잭션 커밋 후 캐시 갱신
                .build();
    }

    /**
     * 캐시 역직렬화 오류 시 해당 키를 제거해 반복 오류를 방지한다.
     */
    @Bean
    public CacheErrorHandler cacheErrorHandler() {
        return new SimpleCacheErrorHandler() {
            @Override
            public void handleCacheGetError(RuntimeException exception, Cache cache, Object key) {
                cache.evict(key);
                super.handleCacheGetError(exception, cache, key);
            }
        };
    }
}
