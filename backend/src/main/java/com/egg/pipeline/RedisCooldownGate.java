package com.egg.pipeline;

import com.egg.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Cooldown gate shared by all instances through Redis.
 *
 * Keys per user:
 * - egg:ai:processing:{userId}: run in progress. Set with SET NX and a lease TTL so a
 *   crashed holder cannot block the user forever.
 * - egg:ai:cooldown:{userId}: last attempt start. Set with SET NX and TTL = cooldown;
 *   its presence means the cooldown has not elapsed.
 *
 * Acquire takes the processing key first. Only its holder then tries the cooldown key,
 * and gives the processing key back if the cooldown is still running.
 */
@Component
@ConditionalOnProperty(name = "app.pipeline.cooldown-store", havingValue = "redis")
@Slf4j
public class RedisCooldownGate implements CooldownGate {

    static final String PROCESSING_KEY_PREFIX = "egg:ai:processing:";
    static final String COOLDOWN_KEY_PREFIX = "egg:ai:cooldown:";

    private final RedisTemplate<String, String> redisStringTemplate;
    private final PipelineProperties properties;
    private final Clock clock;

    public RedisCooldownGate(@Qualifier("redisStringTemplate") RedisTemplate<String, String> redisStringTemplate,
                             PipelineProperties properties,
                             Clock clock) {
        this.redisStringTemplate = redisStringTemplate;
        this.properties = properties;
        this.clock = clock;
        log.info("Using Redis cooldown gate: cooldown={}s", properties.getUserCooldownSec());
    }

    @Override
    public boolean tryAcquire(UUID userId) {
        String now = String.valueOf(clock.millis());
        String processingKey = PROCESSING_KEY_PREFIX + userId;

        Boolean locked = redisStringTemplate.opsForValue()
                .setIfAbsent(processingKey, now, properties.transcribingGrace());
        if (!Boolean.TRUE.equals(locked)) {
            log.debug("Cooldown gate denied (processing): userId={}", userId);
            return false;
        }

        Duration cooldown = properties.userCooldown();
        if (cooldown.isZero()) {
            return true;
        }

        Boolean fresh = redisStringTemplate.opsForValue()
                .setIfAbsent(COOLDOWN_KEY_PREFIX + userId, now, cooldown);
        if (!Boolean.TRUE.equals(fresh)) {
            redisStringTemplate.delete(processingKey);
            log.debug("Cooldown gate denied (cooldown): userId={}", userId);
            return false;
        }
        return true;
    }

    @Override
    public void release(UUID userId) {
        redisStringTemplate.delete(PROCESSING_KEY_PREFIX + userId);
    }

    @Override
    public GateState state(UUID userId) {
        boolean processing = Boolean.TRUE.equals(redisStringTemplate.hasKey(PROCESSING_KEY_PREFIX + userId));
        Long ttlMs = redisStringTemplate.getExpire(COOLDOWN_KEY_PREFIX + userId, TimeUnit.MILLISECONDS);
        Duration remaining = ttlMs != null && ttlMs > 0 ? Duration.ofMillis(ttlMs) : Duration.ZERO;
        return new GateState(processing, remaining);
    }
}
