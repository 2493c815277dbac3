// TagCacheProperties.java
package ac.tagcache.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "tagcache")
public class TagCacheProperties {

    /**
     * Backend name: memory, redis or redis-sentinel.
     */
    private String backend = "memory";

    /**
     * Namespace prepended to every key the cache writes.
     */
    private String prefix = "cache:";

    @NestedConfigurationProperty
    private RedisProperties redis = new RedisProperties();

    @NestedConfigurationProperty
    private SentinelProperties sentinel = new SentinelProperties();

    // Getters and setters
    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }

    public String getPrefix() { return prefix; }
    public void setPrefix(String prefix) { this.prefix = prefix; }

    public RedisProperties getRedis() { return redis; }
    public void setRedis(RedisProperties redis) { this.redis = redis; }

    public SentinelProperties getSentinel() { return sentinel; }
    public void setSentinel(SentinelProperties sentinel) { this.sentinel = sentinel; }

    public static class RedisProperties {
        private String host = "localhost";
        private int port = 6379;
        private int database = 0;
        private String password;
        private Duration timeout = Duration.ofMillis(100);
        private Duration connectTimeout = Duration.ofMillis(100);
        private boolean keepAlive = true;
        private Duration pingConnectionInterval = Duration.ofSeconds(30);

        // Getters and setters
        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getDatabase() { return database; }
        public void setDatabase(int database) { this.database = database; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public boolean isKeepAlive() { return keepAlive; }
        public void setKeepAlive(boolean keepAlive) { this.keepAlive = keepAlive; }

        public Duration getPingConnectionInterval() { return pingConnectionInterval; }
        public void setPingConnectionInterval(Duration pingConnectionInterval) { this.pingConnectionInterval = pingConnectionInterval; }
    }

    public static class SentinelProperties {
        /**
         * Sentinel nodes as host:port.
         */
        private List<String> nodes = new ArrayList<>();
        private String serviceName;
        private String password;

        // Getters and setters
        public List<String> getNodes() { return nodes; }
        public void setNodes(List<String> nodes) { this.nodes = nodes; }

        public String getServiceName() { return serviceName; }
        public void setServiceName(String serviceName) { this.serviceName = serviceName; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }
}
