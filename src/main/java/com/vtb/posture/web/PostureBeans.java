package com.vtb.posture.web;

import com.vtb.posture.config.PostureConfig;
import com.vtb.posture.core.ScoringSettings;
import com.vtb.posture.core.SecurityScoringEngine;
import com.vtb.posture.keywords.SensitiveKeywordRegistry;
import com.vtb.posture.service.ElasticsearchTrafficLogSource;
import com.vtb.posture.service.EndpointConfigSource;
import com.vtb.posture.service.JsonLinesTrafficLogSource;
import com.vtb.posture.service.PostureScoringService;
import com.vtb.posture.service.TrafficLogSource;
import com.vtb.posture.service.YamlEndpointConfigSource;
import com.vtb.posture.share.ShareLinkService;
import com.vtb.posture.share.ShareSnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Сборка компонентов оценщика из {@link PostureConfig}.
 * Ошибка в весах или словаре останавливает запуск приложения.
 */
@Slf4j
@Configuration
public class PostureBeans {

    @Bean
    public PostureConfig postureConfig() {
        return PostureConfig.load();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ScoringSettings scoringSettings(PostureConfig config) {
        return config.toScoringSettings();
    }

    @Bean
    public SensitiveKeywordRegistry sensitiveKeywordRegistry(PostureConfig config) {
        SensitiveKeywordRegistry registry = new SensitiveKeywordRegistry(config.getKeywords().getSource());
        registry.initialize();
        return registry;
    }

    @Bean
    public SecurityScoringEngine securityScoringEngine(ScoringSettings settings, SensitiveKeywordRegistry registry) {
        return new SecurityScoringEngine(settings, registry::current);
    }

    @Bean
    public EndpointConfigSource endpointConfigSource(PostureConfig config) {
        return new YamlEndpointConfigSource(Path.of(config.getSources().getEndpointsFile()));
    }

    @Bean
    public TrafficLogSource trafficLogSource(PostureConfig config) {
        PostureConfig.Elasticsearch elasticsearch = config.getSources().getElasticsearch();
        if (elasticsearch.isEnabled()) {
            return new ElasticsearchTrafficLogSource(elasticsearch);
        }
        log.info("Журналы трафика читаются из каталога {}", config.getSources().getTrafficDirectory());
        return new JsonLinesTrafficLogSource(Path.of(config.getSources().getTrafficDirectory()));
    }

    @Bean(destroyMethod = "close")
    public PostureScoringService postureScoringService(SecurityScoringEngine engine,
                                                       EndpointConfigSource configSource,
                                                       TrafficLogSource trafficSource,
                                                       Clock clock,
                                                       PostureConfig config) {
        PostureConfig.Dashboard dashboard = config.getDashboard();
        return new PostureScoringService(engine, configSource, trafficSource, clock,
            dashboard.getDefaultRangeDays(), dashboard.getMaxRangeDays(), dashboard.getParallelism());
    }

    @Bean
    public ShareLinkService shareLinkService(Clock clock, PostureConfig config) {
        return new ShareLinkService(new ShareSnapshotStore(clock, Duration.ofHours(config.getShare().getTtlHours())));
    }
}
