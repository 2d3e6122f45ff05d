/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.metadata;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.Version;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.metadata.model.ApiKeyItem;
import io.clipsense4j.core.metadata.model.EmailItem;
import io.clipsense4j.core.metadata.model.EnvAssignment;
import io.clipsense4j.core.metadata.model.EnvSection;
import io.clipsense4j.core.metadata.model.EnvVarItem;
import io.clipsense4j.core.metadata.model.HashItem;
import io.clipsense4j.core.metadata.model.IpAddressItem;
import io.clipsense4j.core.metadata.model.JwtClaims;
import io.clipsense4j.core.metadata.model.JwtItem;
import io.clipsense4j.core.metadata.model.MetadataDocument;
import io.clipsense4j.core.metadata.model.UrlItem;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetadataCodecTest {

    private static final String SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    private final MetadataCodec codec = new MetadataCodec(FamilyMaskCache.bounded(16, Runnable::run));

    private static MetadataDocument mixed() {
        return MetadataDocument.builder()
                .emails(List.of(new EmailItem("a@example.com", 0.95), new EmailItem("b@example.com", 0.95)))
                .urls(List.of(new UrlItem("https://github.com/x", "github.com", "github", 0.95)))
                .hashes(List.of(new HashItem(SHA256, "sha256", 256, 0.85)))
                .build();
    }

    @Test
    void jacksonModules_shouldShareOneReleaseLine() {
        Version core = com.fasterxml.jackson.core.json.PackageVersion.VERSION;
        Version databind = com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION;

        assertThat(databind.getMajorVersion()).isEqualTo(core.getMajorVersion());
        assertThat(databind.getMinorVersion()).isEqualTo(core.getMinorVersion());
    }

    @Test
    void serialize_shouldOmitAbsentFamilies() {
        assertThat(codec.serialize(MetadataDocument.empty())).isEqualTo("{}");
        assertThat(codec.serialize((MetadataDocument) null)).isEqualTo("{}");

        String json = codec.serialize(mixed());
        assertThat(json).contains("\"emails\"", "\"urls\"", "\"hashes\"").doesNotContain("\"env\"", "\"prose\"");
    }

    @Test
    void parse_shouldReadBackSerializedDocuments() {
        MetadataDocument doc = mixed();

        assertThat(codec.parse(codec.serialize(doc))).isEqualTo(doc);
    }

    @Test
    void parse_shouldTreatUnreadableInputAsEmpty() {
        assertThat(codec.parse(null).isEmpty()).isTrue();
        assertThat(codec.parse("  ").isEmpty()).isTrue();
        assertThat(codec.parse("{not json").isEmpty()).isTrue();
        assertThat(codec.parse("{\"unknownKey\":1}").isEmpty()).isTrue();
    }

    @Test
    void serialize_shouldWriteEnvAssignments() {
        String json = codec.serialize(new EnvAssignment("FOO", true));

        assertThat(json).contains("\"key\":\"FOO\"", "\"isExported\":true");
    }

    @Test
    void containsFamily_shouldAnswerPerFamily() {
        String json = codec.serialize(mixed());

        assertThat(codec.containsFamily(ContentType.EMAIL, json)).isTrue();
        assertThat(codec.containsFamily(ContentType.HASH, json)).isTrue();
        assertThat(codec.containsFamily(ContentType.IP_ADDRESS, json)).isFalse();
        assertThat(codec.containsFamily(ContentType.TEXT, json)).isFalse();
        assertThat(codec.containsFamily(ContentType.EMAIL, "")).isFalse();
        assertThat(codec.containsFamily(ContentType.EMAIL, "{\"emails\": [")).isFalse();
    }

    @Test
    void containsFamily_shouldDistinguishEnvBlocks() {
        EnvVarItem item = new EnvVarItem("FOO", "bar", false, 0.95);
        String single = codec.serialize(MetadataDocument.builder().env(new EnvSection(false, List.of(item))).build());
        String block = codec.serialize(MetadataDocument.builder().env(new EnvSection(true, List.of(item))).build());

        assertThat(codec.containsFamily(ContentType.ENV_VAR, single)).isTrue();
        assertThat(codec.containsFamily(ContentType.ENV_VAR_BLOCK, single)).isFalse();
        assertThat(codec.containsFamily(ContentType.ENV_VAR_BLOCK, block)).isTrue();
    }

    @Test
    void extractAll_shouldInterleaveFamilies() {
        String json = codec.serialize(mixed());

        assertThat(codec.extractAll(json))
                .extracting(ExtractedValue::value)
                .containsExactly("a@example.com", "https://github.com/x", SHA256, "b@example.com");
        assertThat(codec.extractAll(json, 2))
                .extracting(ExtractedValue::type)
                .containsExactly(ContentType.EMAIL, ContentType.URL);
        assertThat(codec.extractAll(json, 0)).isEmpty();
    }

    @Test
    void extractValues_shouldBuildDisplayLabels() {
        MetadataDocument doc = MetadataDocument.builder()
                .urls(List.of(new UrlItem("https://github.com/x", "github.com", "github", 0.95)))
                .ipAddresses(List.of(new IpAddressItem("10.0.0.1", "v4", true, false, false, false, 0.9)))
                .hashes(List.of(new HashItem(SHA256, "sha256", 256, 0.85)))
                .apiKeys(List.of(new ApiKeyItem("ghp_x", "GitHub PAT", true, 0.95)))
                .jwt(List.of(new JwtItem("a.b.c", "{}", "{}", new JwtClaims(null, null, null, 1L), true, 0.95)))
                .env(new EnvSection(false, List.of(new EnvVarItem("EMPTY", "", false, 0.95))))
                .build();
        String json = codec.serialize(doc);

        assertThat(codec.extractValues(ContentType.URL, json).get(0).displayValue()).isEqualTo("github.com");
        assertThat(codec.extractValues(ContentType.IP_ADDRESS, json).get(0).displayValue()).isEqualTo("10.0.0.1 (V4)");
        assertThat(codec.extractValues(ContentType.HASH, json).get(0).displayValue()).isEqualTo("SHA256: " + SHA256);
        assertThat(codec.extractValues(ContentType.API_KEY, json).get(0).displayValue()).isEqualTo("GitHub PAT: ghp_x");
        assertThat(codec.extractValues(ContentType.JWT, json).get(0).displayValue()).isEqualTo("JWT (expired)");
        assertThat(codec.extractValues(ContentType.ENV_VAR, json).get(0).value()).isEqualTo("EMPTY");
        assertThat(codec.extractValues(ContentType.ENV_VAR_BLOCK, json)).isEmpty();
    }

    @Test
    void countItems_shouldCountPerFamily() {
        String json = codec.serialize(mixed());

        assertThat(codec.countItems(ContentType.EMAIL, json)).isEqualTo(2);
        assertThat(codec.countItems(ContentType.URL, json)).isEqualTo(1);
        assertThat(codec.countItems(ContentType.CODE, json)).isZero();
        assertThat(codec.countItems(ContentType.TEXT, json)).isZero();
        assertThat(codec.countItems(null, json)).isZero();
    }
}
