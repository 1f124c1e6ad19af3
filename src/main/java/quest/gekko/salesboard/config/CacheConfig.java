package quest.gekko.salesboard.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String LEADERBOARD_ROWS = "leaderboardRows";

    // snapshot rows never change, expiry only bounds memory
    @Bean
    public Caffeine<Object, Object> caffeine() {
        return Caffeine.newBuilder().maximumSize(2_000).expireAfterAccess(Duration.ofHours(6));
    }

    @Bean
    public CacheManager cacheManager(final Caffeine<Object, Object> caffeine) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(LEADERBOARD_ROWS);
        cacheManager.setCaffeine(caffeine);
        return cacheManager;
    }
}
