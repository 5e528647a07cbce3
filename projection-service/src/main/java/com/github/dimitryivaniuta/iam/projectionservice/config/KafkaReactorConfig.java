package com.github.dimitryivaniuta.iam.projectionservice.config;

import com.github.dimitryivaniuta.iam.common.kafka.AppKafkaProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;

@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "kafka", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KafkaReactorConfig {

    private final ReceiverOptions<String, byte[]> base;
    private final AppKafkaProperties props;

    @Bean
    public KafkaReceiver<String, byte[]> kafkaReceiver() {
        return KafkaReceiver.create(base.subscription(props.allEventTopics()));
    }
}
