package com.github.dimitryivaniuta.iam.common.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import reactor.kafka.receiver.ReceiverOptions;

import java.util.HashMap;
import java.util.Map;

/**
 * Exposes the typed Kafka properties and the base {@link ReceiverOptions} used by the
 * real-time event listener. Topic subscription is left to the consuming service.
 */
@AutoConfiguration
@EnableConfigurationProperties({
        AppKafkaProperties.class
})
public class KafkaCommonAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ReceiverOptions<String, byte[]> receiverOptions(AppKafkaProperties p) {
        Map<String, Object> cfg = new HashMap<>();
        cfg.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, p.getBootstrapServers());
        cfg.put(ConsumerConfig.CLIENT_ID_CONFIG, p.getClientId());
        cfg.put(ConsumerConfig.GROUP_ID_CONFIG, p.getGroupId());
        cfg.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        cfg.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        cfg.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        cfg.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, p.getConsumer().getAutoOffsetReset());
        cfg.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, p.getConsumer().getMaxPollRecords());
        return ReceiverOptions.<String, byte[]>create(cfg)
                .commitInterval(p.getConsumer().getCommitInterval());
    }
}
