package com.transittracker.engine.config;

import com.transittracker.engine.dto.ServiceArea;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.service.feed.DirectFeedTransport;
import com.transittracker.engine.service.feed.FeedAcquirer;
import com.transittracker.engine.service.feed.FeedTransport;
import com.transittracker.engine.service.feed.MockFeedGenerator;
import com.transittracker.engine.service.feed.RelayedFeedTransport;
import com.transittracker.engine.service.feed.VehicleFeedDecoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wiring of the feed pipeline: HTTP client, fetch executor, transports and
 * the acquirer.
 *
 * Transport selection happens here, once. The bus feed is served on a
 * standard port and is always fetched directly; the train feed goes
 * through the relay when {@code transit.feeds.relayed} is set.
 */
@Configuration
@EnableConfigurationProperties(TransitProperties.class)
@Slf4j
public class FeedClientConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ServiceArea serviceArea(TransitProperties properties) {
        return properties.getServiceArea().toServiceArea();
    }

    /**
     * RestTemplate used by both transports. Connect and read timeouts equal
     * the fetch bound so a hung socket cannot outlive its refresh cycle.
     */
    @Bean
    public RestTemplate feedRestTemplate(RestTemplateBuilder builder, TransitProperties properties) {
        Duration timeout = properties.getCache().getFetchTimeout();
        return builder
            .setConnectTimeout(timeout)
            .setReadTimeout(timeout)
            .defaultHeader("Accept",
                MediaType.APPLICATION_JSON_VALUE + ", " + MediaType.APPLICATION_OCTET_STREAM_VALUE + ", */*")
            .build();
    }

    /**
     * Pool for upstream fetches. Two feeds, each with at most one fetch in
     * flight, plus room for fetches that outlived their timeout.
     */
    @Bean(name = "feedExecutor")
    public ThreadPoolTaskExecutor feedExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("feed-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public MockFeedGenerator mockFeedGenerator(TransitProperties properties, ServiceArea serviceArea) {
        TransitProperties.Feeds feeds = properties.getFeeds();
        return new MockFeedGenerator(serviceArea, feeds.getMockSeed(),
            feeds.getMockBusCount(), feeds.getMockTrainCount());
    }

    @Bean
    public FeedAcquirer feedAcquirer(
        TransitProperties properties,
        @Qualifier("feedRestTemplate") RestTemplate feedRestTemplate,
        VehicleFeedDecoder decoder,
        MockFeedGenerator mockFeedGenerator,
        Clock clock
    ) {
        TransitProperties.Feeds feeds = properties.getFeeds();

        Map<VehicleClass, FeedTransport> transports = new EnumMap<>(VehicleClass.class);
        Map<VehicleClass, String> urls = new EnumMap<>(VehicleClass.class);

        if (!feeds.isMockMode()) {
            FeedTransport direct = new DirectFeedTransport(feedRestTemplate);
            FeedTransport trainTransport = feeds.isRelayed()
                ? new RelayedFeedTransport(feedRestTemplate, feeds.getRelayUrl(), feeds.getRelayParam())
                : direct;

            transports.put(VehicleClass.BUS, direct);
            transports.put(VehicleClass.TRAIN, trainTransport);
            urls.put(VehicleClass.BUS, feeds.getBusUrl());
            urls.put(VehicleClass.TRAIN, feeds.getTrainUrl());
        }

        log.info("Feed acquirer configured: mockMode={}, transports={}", feeds.isMockMode(),
            feeds.isMockMode() ? List.of("mock") : transports.values().stream().map(FeedTransport::name).toList());

        return new FeedAcquirer(transports, urls, decoder, mockFeedGenerator, feeds.isMockMode(), clock);
    }
}
