package com.mythosmud.socket.kafka;

import com.mythosmud.socket.bus.BrokerMessage;
import com.mythosmud.socket.bus.MessageBroker;
import com.mythosmud.socket.config.SocketConfig;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka-backed broker: one broadcast topic shared by all nodes.
 * <p>
 * Records are keyed by subject so ordering holds per subject. Every node consumes all
 * partitions under its own consumer group ({@code relay-{nodeId}}) starting from the latest
 * offset; a node that was down misses what was published meanwhile.
 * </p>
 * <p>
 * The producer does not retry on its own. Retries, backoff and dead-lettering belong to
 * {@link com.mythosmud.socket.bus.DistributedEventBus}.
 * </p>
 */
public class KafkaMessageBroker implements MessageBroker {
    private static final Logger log = LoggerFactory.getLogger(KafkaMessageBroker.class);

    private static final int DEFAULT_PARTITIONS = 6;
    private static final short REPLICATION_FACTOR = 1;    // Replication factor (1 for dev, 3+ for prod)

    private final SocketConfig config;
    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;
    private final Sinks.Many<BrokerMessage> inbound = Sinks.many().multicast().directBestEffort();
    private volatile Disposable consumer;

    public KafkaMessageBroker(SocketConfig config) {
        this.config = config;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "false");
        producerProps.put(ProducerConfig.RETRIES_CONFIG, 0);
        producerProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, (int) config.getBusPublishTimeoutMs());
        producerProps.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) config.getBusPublishTimeoutMs());
        producerProps.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, (int) config.getBusPublishTimeoutMs() + 1000);

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        log.info("Kafka producer and admin client initialized for topic {}", config.getKafkaTopic());
    }

    @Override
    public Mono<Void> start() {
        String topic = config.getKafkaTopic();
        return createTopicIfNotExists(topic, DEFAULT_PARTITIONS, REPLICATION_FACTOR)
            .publishOn(Schedulers.boundedElastic())
            .doOnSuccess(v -> {
                Map<String, Object> consumerProps = new HashMap<>();
                consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
                consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, "relay-" + config.getNodeId());
                consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
                consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

                ReceiverOptions<String, String> receiverOptions = ReceiverOptions.<String, String>create(consumerProps)
                    .subscription(Collections.singleton(topic));

                consumer = KafkaReceiver.create(receiverOptions)
                    .receive()
                    .doOnNext(record -> {
                        inbound.emitNext(new BrokerMessage(record.key(), record.value()),
                            Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
                        record.receiverOffset().acknowledge();
                    })
                    .onErrorContinue((err, obj) -> log.error("Error in broadcast consumer loop", err))
                    .subscribe();

                log.info("Node {} consuming broadcast topic {}", config.getNodeId(), topic);
            });
    }

    @Override
    public Mono<Void> publish(String subject, String payload) {
        ProducerRecord<String, String> record = new ProducerRecord<>(config.getKafkaTopic(), subject, payload);
        return sender.send(Mono.just(SenderRecord.create(record, subject)))
            .next()
            .flatMap(result -> result.exception() != null
                ? Mono.<Void>error(result.exception())
                : Mono.<Void>empty());
    }

    @Override
    public Flux<BrokerMessage> messages() {
        return inbound.asFlux();
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            Disposable current = consumer;
            if (current != null) {
                current.dispose();
            }
            inbound.tryEmitComplete();
            sender.close();
            adminClient.close();
            log.info("Kafka broker stopped");
        });
    }

    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    NewTopic newTopic = new NewTopic(topicName, partitions, replicationFactor);

                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);

                    return adminClient.createTopics(Collections.singleton(newTopic))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException || error instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }
}
