package com.payment.checkout.config;

import com.payment.checkout.statedata.StateDataRedisSerializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.util.Map;

/**
 * Redis configuration for checkout state data. Values are plain JSON objects
 * (no @class type hints) so the storefront side can read them too.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, Map<String, Object>> stateDataRedisTemplate(
            RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, Map<String, Object>> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new StateDataRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(new StateDataRedisSerializer());
        template.afterPropertiesSet();
        return template;
    }
}
