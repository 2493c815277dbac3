package ac.tagcache;

import ac.tagcache.exception.CacheConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum BackendType {
    MEMORY("memory"),
    REDIS("redis"),
    REDIS_SENTINEL("redis-sentinel");

    private final String backendName;

    BackendType(String backendName) {
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }

    public static BackendType fromName(String name) {
        if (name != null) {
            for (BackendType type : values()) {
                if (type.backendName.equalsIgnoreCase(name.trim())) {
                    return type;
                }
            }
        }
        String supported = Arrays.stream(values())
                .map(BackendType::getBackendName)
                .collect(Collectors.joining(", "));
        throw new CacheConfigurationException("Unsupported backend: " + name + " (supported: " + supported + ")");
    }
}
