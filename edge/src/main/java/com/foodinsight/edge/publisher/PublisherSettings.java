package com.foodinsight.edge.publisher;

import java.time.Duration;
import java.util.Properties;

public record PublisherSettings(
    String bootstrapServers,
    String topic,
    Duration batchInterval,
    Duration sendTimeout,
    int maxBacklog,
    boolean publishEmpty) {

    public PublisherSettings {
        if (batchInterval.isNegative() || batchInterval.isZero()) {
            throw new IllegalArgumentException("batch.interval.ms must be positive: " + batchInterval);
        }
        if (maxBacklog < 1) {
            throw new IllegalArgumentException("publisher.max.backlog must be at least 1: " + maxBacklog);
        }
    }

    public static PublisherSettings fromProperties(Properties props) {
        return new PublisherSettings(
            props.getProperty("kafka.bootstrap.servers", "localhost:9092"),
            props.getProperty("kafka.topic", "inventory-deltas"),
            Duration.ofMillis(Long.parseLong(props.getProperty("batch.interval.ms", "1000").trim())),
            Duration.ofMillis(Long.parseLong(props.getProperty("publisher.send.timeout.ms", "10000").trim())),
            Integer.parseInt(props.getProperty("publisher.max.backlog", "100").trim()),
            Boolean.parseBoolean(props.getProperty("publisher.publish.empty", "false").trim()));
    }

    /**
     * Producer properties, with any {@code kafka.producer.*} key passed through verbatim.
     */
    public static Properties producerProperties(Properties appProps) {
        Properties kafkaProps = new Properties();
        kafkaProps.put("bootstrap.servers", appProps.getProperty("kafka.bootstrap.servers", "localhost:9092"));
        kafkaProps.put("acks", appProps.getProperty("kafka.acks", "all"));
        kafkaProps.put("retries", appProps.getProperty("kafka.retries", "3"));
        kafkaProps.put("linger.ms", appProps.getProperty("kafka.linger.ms", "5"));
        kafkaProps.put("compression.type", appProps.getProperty("kafka.compression.type", "gzip"));
        kafkaProps.put("key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        kafkaProps.put("value.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        String prefix = "kafka.producer.";
        for (String key : appProps.stringPropertyNames()) {
            if (key.startsWith(prefix)) {
                kafkaProps.put(key.substring(prefix.length()), appProps.getProperty(key));
            }
        }
        return kafkaProps;
    }
}
