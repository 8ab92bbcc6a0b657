package com.signalrelay.ingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalrelay.common.parse.SignalParser;
import com.signalrelay.ingest.forward.ForwardingStats;
import com.signalrelay.ingest.forward.RestSignalForwarder;
import com.signalrelay.ingest.forward.SignalForwarder;
import com.signalrelay.ingest.pipeline.IngestionPipeline;
import com.signalrelay.ingest.reconcile.ReconciliationLoader;
import com.signalrelay.ingest.state.SignalState;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Configuration
public class SignalRelayConfig {

    private static final Logger log = LoggerFactory.getLogger(SignalRelayConfig.class);

    @Value("${signal.zone:}")
    private String zone;

    @Value("${signal.default-chat-id:}")
    private String defaultChatId;

    @Value("${signal.history.capacity:50}")
    private int historyCapacity;

    @Value("${signal.sink.urls:}")
    private String sinkUrls;

    @Value("${signal.sink.timeout:10s}")
    private Duration sinkTimeout;

    @Value("${signal.reconciliation.url:}")
    private String reconciliationUrl;

    @Value("${signal.reconciliation.timeout:10s}")
    private Duration reconciliationTimeout;

    @Value("${signal.reconciliation.newest-first:true}")
    private boolean reconciliationNewestFirst;

    @Bean
    public Clock clock() {
        return zone.isBlank() ? Clock.systemDefaultZone() : Clock.system(ZoneId.of(zone));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public SignalParser signalParser(ObjectMapper objectMapper, Clock clock) {
        return new SignalParser(objectMapper, clock);
    }

    @Bean
    public WebClient sinkClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(15))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(15, TimeUnit.SECONDS))
            );

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public ForwardingStats forwardingStats() {
        return new ForwardingStats();
    }

    @Bean
    public SignalForwarder signalForwarder(WebClient sinkClient, ForwardingStats forwardingStats) {
        List<String> urls = sinkUrlList();
        log.info("Signal forwarding configured. sinks={} timeout={}", urls.size(), sinkTimeout);
        return new RestSignalForwarder(sinkClient, urls, sinkTimeout, forwardingStats);
    }

    @Bean
    public ReconciliationLoader reconciliationLoader(WebClient sinkClient,
                                                     SignalParser signalParser,
                                                     ObjectMapper objectMapper) {
        String source = reconciliationUrl;
        if (source.isBlank()) {
            List<String> urls = sinkUrlList();
            source = urls.isEmpty() ? "" : urls.get(0);
        }
        return new ReconciliationLoader(sinkClient, source, reconciliationTimeout,
                                        reconciliationNewestFirst, signalParser, objectMapper);
    }

    /**
     * Built and seeded while the context refreshes, so the startup load has finished
     * (or failed) before the web server accepts a request.
     */
    @Bean
    public SignalState signalState(ReconciliationLoader reconciliationLoader, Clock clock) {
        SignalState state = new SignalState(historyCapacity, clock);
        state.seed(reconciliationLoader.load());
        return state;
    }

    @Bean
    public IngestionPipeline ingestionPipeline(SignalParser signalParser,
                                               SignalState signalState,
                                               SignalForwarder signalForwarder) {
        return new IngestionPipeline(signalParser, signalState, signalForwarder, defaultChatId);
    }

    private List<String> sinkUrlList() {
        return Arrays.stream(sinkUrls.split(","))
            .map(String::trim)
            .filter(u -> !u.isEmpty())
            .toList();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url().getHost());
            return Mono.just(clientRequest);
        });
    }
}
