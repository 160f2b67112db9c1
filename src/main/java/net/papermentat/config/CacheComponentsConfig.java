/**
 * Configuration class for cache-related beans
 * - Per-DOI open-access verdicts, so a DOI repeated across topics or list entries
 *   costs one provider round-trip per run
 */
package net.papermentat.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import net.papermentat.model.OpenAccessInfo;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;

@Configuration
public class CacheComponentsConfig {

    @Bean
    public Cache<String, Optional<OpenAccessInfo>> openAccessCache(PaperMentatProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.getOaCache().getMaxSize())
                .expireAfterWrite(properties.getOaCache().getTtl())
                .recordStats()
                .build();
    }
}
