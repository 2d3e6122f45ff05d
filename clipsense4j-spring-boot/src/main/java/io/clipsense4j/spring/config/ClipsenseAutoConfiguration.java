/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.spring.config;

import io.clipsense4j.core.api.ClassificationOptions;
import io.clipsense4j.core.api.Detector;
import io.clipsense4j.core.capture.CaptureEnricher;
import io.clipsense4j.core.classify.ContentClassifier;
import io.clipsense4j.core.detect.PathProbe;
import io.clipsense4j.core.encoding.EncodingResolver;
import io.clipsense4j.core.metadata.FamilyMaskCache;
import io.clipsense4j.core.metadata.MetadataCodec;
import io.clipsense4j.core.preset.DetectorConfig;
import io.clipsense4j.core.preset.DetectorRegistry;
import io.clipsense4j.core.report.NoopReporter;
import io.clipsense4j.core.report.Reporter;
import io.clipsense4j.spring.ClipsenseEndpoint;
import io.clipsense4j.spring.ClipsenseProperties;
import io.clipsense4j.spring.MicrometerReporter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@AutoConfiguration(
        afterName = {
            "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
            "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
        })
@EnableConfigurationProperties(ClipsenseProperties.class)
@ConditionalOnProperty(prefix = "clipsense4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ClipsenseAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(Reporter.class)
        public MicrometerReporter micrometerReporter(MeterRegistry registry, ClipsenseProperties props) {
            return new MicrometerReporter(registry, props.getReporter().getCapacity());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.endpoint.annotation.Endpoint")
    static class EndpointConfiguration {

        @Bean
        @ConditionalOnBean(MicrometerReporter.class)
        @ConditionalOnAvailableEndpoint(endpoint = ClipsenseEndpoint.class)
        public ClipsenseEndpoint clipsenseEndpoint(
                MicrometerReporter reporter, FamilyMaskCache maskCache, ClipsenseProperties props) {
            var families = props.getDetectors().isEmpty()
                    ? DetectorRegistry.PRIORITY
                    : DetectorRegistry.PRIORITY.stream()
                            .filter(props.getDetectors()::contains)
                            .toList();
            return new ClipsenseEndpoint(reporter, maskCache, families);
        }
    }

    @Bean
    @ConditionalOnMissingBean(Reporter.class)
    public Reporter clipsenseReporter() {
        return new NoopReporter();
    }

    @Bean
    @ConditionalOnMissingBean
    public DetectorRegistry clipsenseDetectorRegistry() {
        return new DetectorRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public DetectorConfig clipsenseDetectorConfig(ClipsenseProperties props) {
        return new DetectorConfig(
                Clock.systemUTC(),
                PathProbe.timeoutGuarded(props.getFilePaths().getStatTimeout()));
    }

    @Bean
    @ConditionalOnMissingBean
    public EncodingResolver clipsenseEncodingResolver(ClipsenseProperties props) {
        return new EncodingResolver(Math.max(0, props.getMaxDecodeRounds()));
    }

    @Bean
    @ConditionalOnMissingBean
    public FamilyMaskCache clipsenseFamilyMaskCache(ClipsenseProperties props) {
        return FamilyMaskCache.bounded(props.getMetadata().getCacheCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public MetadataCodec clipsenseMetadataCodec(FamilyMaskCache cache) {
        return new MetadataCodec(cache);
    }

    @Bean
    @ConditionalOnMissingBean
    public ClassificationOptions clipsenseClassificationOptions(ClipsenseProperties props) {
        return props.toOptions();
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentClassifier contentClassifier(
            ClipsenseProperties props,
            DetectorRegistry registry,
            DetectorConfig detectorConfig,
            EncodingResolver resolver,
            MetadataCodec codec,
            Reporter reporter) {
        List<Detector<?>> detectors = registry.build(props.getDetectors(), detectorConfig);
        return new ContentClassifier(detectors, resolver, codec, reporter);
    }

    @Bean
    @ConditionalOnMissingBean
    public CaptureEnricher captureEnricher(ContentClassifier classifier) {
        return new CaptureEnricher(classifier);
    }
}
