package org.whiteelephant.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.whiteelephant.service.play.stream.LocalPlayNotifications;
import org.whiteelephant.service.play.stream.PgNotificationSourceFactory;
import org.whiteelephant.service.play.stream.PlayEventHub;
import org.whiteelephant.service.play.stream.PlayEventNotifier;
import org.whiteelephant.service.play.stream.PlayNotificationSourceFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Câblage du temps réel : un seul hub par process, partagé par le notifier (producteur)
 * et les flux SSE (consommateurs).
 */
@Configuration
public class PlayStreamConfig {

    @Bean
    public PlayEventHub playEventHub(@Value("${app.play.hub.capacity:32}") int capacity) {
        return new PlayEventHub(capacity);
    }

    // un thread par spectateur connecté ; pas de file d'attente : au-delà du max, 503
    @Bean
    public ThreadPoolTaskExecutor playStreamExecutor(@Value("${app.play.stream.max-connections:512}") int maxConnections) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(Math.min(8, maxConnections));
        ex.setMaxPoolSize(maxConnections);
        ex.setQueueCapacity(0);
        ex.setThreadNamePrefix("play-stream-");
        ex.setDaemon(true);
        ex.setWaitForTasksToCompleteOnShutdown(false);
        ex.initialize();
        return ex;
    }

    @Bean
    @ConditionalOnProperty(name = "app.play.notifier.channel", havingValue = "postgres", matchIfMissing = true)
    public PgNotificationSourceFactory pgNotificationSourceFactory(
            DataSource dataSource,
            @Value("${app.play.notifier.channel-name:play}") String channelName) {
        return new PgNotificationSourceFactory(dataSource, channelName);
    }

    // sans LISTEN/NOTIFY (H2, instance unique) : le journal notifie lui-même après commit
    @Bean
    @ConditionalOnProperty(name = "app.play.notifier.channel", havingValue = "local")
    public LocalPlayNotifications localPlayNotifications(ObjectMapper objectMapper) {
        return new LocalPlayNotifications(objectMapper);
    }

    @Bean
    public PlayEventNotifier playEventNotifier(PlayNotificationSourceFactory sources,
                                               PlayEventHub hub,
                                               ObjectMapper objectMapper,
                                               @Value("${app.play.notifier.poll-ms:1000}") long pollMs,
                                               @Value("${app.play.notifier.auto-restart:true}") boolean autoRestart) {
        return new PlayEventNotifier(sources, hub, objectMapper, Duration.ofMillis(pollMs), autoRestart);
    }
}
