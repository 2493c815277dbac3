package ac.tagcache;

import ac.tagcache.codec.KryoValueCodec;
import ac.tagcache.codec.ValueCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// CacheConfiguration.java - connection and namespace settings for every backend
public class CacheConfiguration {
    public static final String DEFAULT_PREFIX = "cache:";

    private final BackendType backend;
    private final String host;
    private final int port;
    private final int database;
    private final String password;
    private final String prefix;
    private final List<String> sentinels;
    private final String serviceName;
    private final String sentinelPassword;
    private final int timeoutMillis;
    private final int connectTimeoutMillis;
    private final boolean keepAlive;
    private final int pingConnectionIntervalMillis;
    private final ValueCodec codec;

    public static class Builder {
        private BackendType backend = BackendType.MEMORY;
        private String host = "localhost";
        private int port = 6379;
        private int database = 0;
        private String password;
        private String prefix = DEFAULT_PREFIX;
        private final List<String> sentinels = new ArrayList<>();
        private String serviceName;
        private String sentinelPassword;
        private int timeoutMillis = 100;
        private int connectTimeoutMillis = 100;
        private boolean keepAlive = true;
        private int pingConnectionIntervalMillis = 30000;
        private ValueCodec codec;

        public Builder backend(BackendType backend) {
            this.backend = backend;
            return this;
        }

        public Builder backend(String backendName) {
            this.backend = BackendType.fromName(backendName);
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder database(int database) {
            this.database = database;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        /**
         * @param address sentinel node as {@code host:port}
         */
        public Builder sentinel(String address) {
            this.sentinels.add(address);
            return this;
        }

        public Builder sentinel(String host, int port) {
            return sentinel(host + ":" + port);
        }

        public Builder sentinels(List<String> addresses) {
            this.sentinels.clear();
            this.sentinels.addAll(addresses);
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder sentinelPassword(String sentinelPassword) {
            this.sentinelPassword = sentinelPassword;
            return this;
        }

        public Builder timeout(int millis) {
            this.timeoutMillis = millis;
            return this;
        }

        public Builder connectTimeout(int millis) {
            this.connectTimeoutMillis = millis;
            return this;
        }

        public Builder keepAlive(boolean keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public Builder pingConnectionInterval(int millis) {
            this.pingConnectionIntervalMillis = millis;
            return this;
        }

        public Builder codec(ValueCodec codec) {
            this.codec = codec;
            return this;
        }

        public CacheConfiguration build() {
            return new CacheConfiguration(this);
        }
    }

    private CacheConfiguration(Builder builder) {
        this.backend = builder.backend;
        this.host = builder.host;
        this.port = builder.port;
        this.database = builder.database;
        this.password = builder.password;
        this.prefix = builder.prefix == null ? DEFAULT_PREFIX : builder.prefix;
        this.sentinels = Collections.unmodifiableList(new ArrayList<>(builder.sentinels));
        this.serviceName = builder.serviceName;
        this.sentinelPassword = builder.sentinelPassword;
        this.timeoutMillis = builder.timeoutMillis;
        this.connectTimeoutMillis = builder.connectTimeoutMillis;
        this.keepAlive = builder.keepAlive;
        this.pingConnectionIntervalMillis = builder.pingConnectionIntervalMillis;
        this.codec = builder.codec != null ? builder.codec : new KryoValueCodec();
    }

    /**
     * Redis URI of the single-server target, e.g. {@code redis://localhost:6379}.
     */
    public String getAddress() {
        return "redis://" + host + ":" + port;
    }

    // Getters
    public BackendType getBackend() { return backend; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public int getDatabase() { return database; }
    public String getPassword() { return password; }
    public String getPrefix() { return prefix; }
    public List<String> getSentinels() { return sentinels; }
    public String getServiceName() { return serviceName; }
    public String getSentinelPassword() { return sentinelPassword; }
    public int getTimeoutMillis() { return timeoutMillis; }
    public int getConnectTimeoutMillis() { return connectTimeoutMillis; }
    public boolean isKeepAlive() { return keepAlive; }
    public int getPingConnectionIntervalMillis() { return pingConnectionIntervalMillis; }
    public ValueCodec getCodec() { return codec; }

    public static Builder builder() {
        return new Builder();
    }
}
