package com.mythosmud.socket.config;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for a socket node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    public enum BrokerType {
        KAFKA,
        LOCAL
    }

    public enum StoreType {
        MEMORY,
        REDIS,
        NONE
    }

    String nodeId;
    int httpPort;

    BrokerType brokerType;
    String kafkaBootstrap;
    String kafkaTopic;
    String redisUrl;
    StoreType muteStore;
    StoreType deadLetterStore;

    // Connections
    int perConnBufferSize;
    int pingInterval;
    int idleTimeout;
    int staleConnectionSec;

    // Bus
    int busMaxAttempts;
    long busBaseBackoffMs;
    long busMaxBackoffMs;
    long busJitterMs;
    long busPublishTimeoutMs;
    int busCallbackQueueSize;
    int deadLetterCapacity;

    // Payload shaping
    int compressionThreshold;
    int maxPayloadSize;
    int maxCompressedSize;

    boolean useVirtualThreads;

    public static SocketConfig fromEnv() {
        return SocketConfig.builder()
                .nodeId(getEnv("NODE_ID", "socket-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .brokerType(BrokerType.valueOf(getEnv("BROKER_TYPE", "kafka").toUpperCase()))
                .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
                .kafkaTopic(getEnv("KAFKA_TOPIC", "mythos.broadcast"))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .muteStore(StoreType.valueOf(getEnv("MUTE_STORE", "redis").toUpperCase()))
                .deadLetterStore(StoreType.valueOf(getEnv("DEAD_LETTER_STORE", "memory").toUpperCase()))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "256")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "10")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "30")))
                .staleConnectionSec(Integer.parseInt(getEnv("STALE_CONNECTION_SEC", "90")))
                .busMaxAttempts(Integer.parseInt(getEnv("BUS_MAX_ATTEMPTS", "4")))
                .busBaseBackoffMs(Long.parseLong(getEnv("BUS_BASE_BACKOFF_MS", "1000")))
                .busMaxBackoffMs(Long.parseLong(getEnv("BUS_MAX_BACKOFF_MS", "30000")))
                .busJitterMs(Long.parseLong(getEnv("BUS_JITTER_MS", "250")))
                .busPublishTimeoutMs(Long.parseLong(getEnv("BUS_PUBLISH_TIMEOUT_MS", "5000")))
                .busCallbackQueueSize(Integer.parseInt(getEnv("BUS_CALLBACK_QUEUE_SIZE", "1024")))
                .deadLetterCapacity(Integer.parseInt(getEnv("DEAD_LETTER_CAPACITY", "1000")))
                .compressionThreshold(Integer.parseInt(getEnv("COMPRESSION_THRESHOLD", "10240")))
                .maxPayloadSize(Integer.parseInt(getEnv("MAX_PAYLOAD_SIZE", "102400")))
                .maxCompressedSize(Integer.parseInt(getEnv("MAX_COMPRESSED_SIZE", "51200")))
                .useVirtualThreads(Boolean.parseBoolean(getEnv("USE_VIRTUAL_THREADS", "false")))
                .build();
    }

    /**
     * Defaults without reading the environment; tests start from this and override.
     */
    public static SocketConfig defaults(String nodeId) {
        return SocketConfig.builder()
                .nodeId(nodeId)
                .httpPort(0)
                .brokerType(BrokerType.LOCAL)
                .kafkaBootstrap("localhost:9092")
                .kafkaTopic("mythos.broadcast")
                .redisUrl("redis://localhost:6379")
                .muteStore(StoreType.NONE)
                .deadLetterStore(StoreType.MEMORY)
                .perConnBufferSize(256)
                .pingInterval(10)
                .idleTimeout(30)
                .staleConnectionSec(90)
                .busMaxAttempts(4)
                .busBaseBackoffMs(1000)
                .busMaxBackoffMs(30000)
                .busJitterMs(0)
                .busPublishTimeoutMs(5000)
                .busCallbackQueueSize(1024)
                .deadLetterCapacity(1000)
                .compressionThreshold(10 * 1024)
                .maxPayloadSize(100 * 1024)
                .maxCompressedSize(50 * 1024)
                .useVirtualThreads(false)
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
