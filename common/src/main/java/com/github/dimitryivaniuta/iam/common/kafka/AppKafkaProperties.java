package com.github.dimitryivaniuta.iam.common.kafka;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "kafka")
public class AppKafkaProperties {

    /** Disables the Kafka event listener entirely (projections then rely on the scheduler). */
    private boolean enabled = true;

    @NotBlank
    private String bootstrapServers = "localhost:9092";

    @NotBlank
    private String clientId = "iam-projections";

    @NotBlank
    private String groupId = "iam-projections";

    private Topics topics = new Topics();
    private Consumer consumer = new Consumer();

    public List<String> allEventTopics() { return topics.getEvents().all(); }

    @Getter
    @Setter
    public static class Topics {
        private Events events = new Events();
    }

    @Getter
    @Setter
    public static class Events {
        /** Events appended by the command side of every IAM instance. */
        @NotBlank private String iam = "iam.events.v1";

        public List<String> all() { return List.of(iam); }
    }

    @Getter
    @Setter
    public static class Consumer {
        @NotBlank private String autoOffsetReset = "latest";
        private int maxPollRecords = 500;
        /** Commit interval used by ReceiverOptions#commitInterval. */
        private Duration commitInterval = Duration.ofSeconds(2);
    }
}
