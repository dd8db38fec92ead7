package kaspi.lab.archiveService.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import kaspi.lab.archiveService.config.ArchiveProperties;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import kaspi.lab.archiveService.service.ResultCache;
import kaspi.lab.archiveService.support.Outcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.ReactiveRedisConnection;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
public class RedisResultCache implements ResultCache {

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final ArchiveProperties props;

    @Override
    public Mono<Outcome<ArchiveRecord>> get(String fileId) {
        String key = key(fileId);
        return redisTemplate.opsForValue().get(key)
                .flatMap(json -> Mono.fromCallable(() -> objectMapper.readValue(json, ArchiveRecord.class)))
                .map(Outcome::succeeded)
                .doOnNext(hit -> log.debug("Cache HIT for key: {}", key))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("Cache MISS for key: {}", key);
                    return Outcome.<ArchiveRecord>empty();
                }))
                .onErrorResume(e -> {
                    log.warn("Redis GET failed for key: {}", key, e);
                    return Mono.just(Outcome.<ArchiveRecord>absorbed(e));
                });
    }

    @Override
    public Mono<Outcome<Void>> put(ArchiveRecord record, Duration ttl) {
        String key = key(record.fileId());
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(record))
                .flatMap(json -> redisTemplate.opsForValue().set(key, json, ttl))
                .map(stored -> {
                    if (!stored) {
                        log.warn("Redis SET was not acknowledged for key: {}", key);
                        return Outcome.<Void>absorbed(new IllegalStateException("SET not acknowledged for " + key));
                    }
                    log.debug("Cached record under key: {} for {}", key, ttl);
                    return Outcome.<Void>empty();
                })
                .onErrorResume(e -> {
                    log.warn("Redis SET failed for key: {}", key, e);
                    return Mono.just(Outcome.<Void>absorbed(e));
                });
    }

    @Override
    public Mono<Outcome<Void>> ping() {
        return redisTemplate.execute(ReactiveRedisConnection::ping)
                .next()
                .map(pong -> Outcome.<Void>empty())
                .onErrorResume(e -> Mono.just(Outcome.<Void>absorbed(e)));
    }

    private String key(String fileId) {
        return props.getCache().getKeyPrefix() + fileId;
    }
}
