package com.visitsync.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.visitsync.adapter.SiteAAdapter;
import com.visitsync.adapter.SiteBAdapter;
import com.visitsync.adapter.snapshot.SnapshotSiteAAdapter;
import com.visitsync.adapter.snapshot.SnapshotSiteBAdapter;
import com.visitsync.service.TypeMappingService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the clock, the JSON mapper and the default snapshot-backed adapters.
 * Browser-backed adapters replace the snapshot ones by declaring their own
 * {@link SiteAAdapter} / {@link SiteBAdapter} beans.
 */
@Configuration
@EnableConfigurationProperties(VisitSyncProperties.class)
public class VisitSyncConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    @ConditionalOnMissingBean(SiteAAdapter.class)
    public SiteAAdapter siteAAdapter(VisitSyncProperties properties,
                                     ObjectMapper objectMapper,
                                     TypeMappingService typeMappingService) {
        return SnapshotSiteAAdapter.load(
            requiredPath(properties.getSnapshot().getSiteA(), "visitsync.snapshot.site-a"),
            objectMapper, typeMappingService);
    }

    @Bean
    @ConditionalOnMissingBean(SiteBAdapter.class)
    public SiteBAdapter siteBAdapter(VisitSyncProperties properties,
                                     ObjectMapper objectMapper,
                                     TypeMappingService typeMappingService) {
        return SnapshotSiteBAdapter.load(
            requiredPath(properties.getSnapshot().getSiteB(), "visitsync.snapshot.site-b"),
            objectMapper, typeMappingService);
    }

    private Path requiredPath(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Property " + property + " must point to a snapshot file");
        }
        return Path.of(value);
    }
}
