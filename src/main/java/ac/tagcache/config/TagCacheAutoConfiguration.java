package ac.tagcache.config;

import ac.tagcache.CacheConfiguration;
import ac.tagcache.TaggedCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TagCacheProperties.class)
public class TagCacheAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CacheConfiguration tagCacheConfiguration(TagCacheProperties properties) {
        TagCacheProperties.RedisProperties redis = properties.getRedis();
        TagCacheProperties.SentinelProperties sentinel = properties.getSentinel();

        return CacheConfiguration.builder()
                .backend(properties.getBackend())
                .prefix(properties.getPrefix())
                .host(redis.getHost())
                .port(redis.getPort())
                .database(redis.getDatabase())
                .password(redis.getPassword())
                .timeout((int) redis.getTimeout().toMillis())
                .connectTimeout((int) redis.getConnectTimeout().toMillis())
                .keepAlive(redis.isKeepAlive())
                .pingConnectionInterval((int) redis.getPingConnectionInterval().toMillis())
                .sentinels(sentinel.getNodes())
                .serviceName(sentinel.getServiceName())
                .sentinelPassword(sentinel.getPassword())
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public TaggedCache taggedCache(CacheConfiguration tagCacheConfiguration) {
        return new TaggedCache(tagCacheConfiguration);
    }
}
