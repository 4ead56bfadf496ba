package com.permit.payment.core;

import com.permit.payment.domain.PaymentIntentResult;
import com.permit.payment.domain.RecoveryResult;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis templates for the idempotency cache, one per cached result type.
 * Velocity counters use the auto-configured {@code StringRedisTemplate}.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, PaymentIntentResult> paymentIntentResultRedisTemplate(
            RedisConnectionFactory connectionFactory) {
        return template(connectionFactory, PaymentIntentResult.class);
    }

    @Bean
    public RedisTemplate<String, RecoveryResult> recoveryResultRedisTemplate(
            RedisConnectionFactory connectionFactory) {
        return template(connectionFactory, RecoveryResult.class);
    }

    private static <T> RedisTemplate<String, T> template(RedisConnectionFactory connectionFactory, Class<T> type) {
        RedisTemplate<String, T> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new JsonRedisValueSerializer<>(type));
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(new JsonRedisValueSerializer<>(type));
        template.afterPropertiesSet();
        return template;
    }
}
