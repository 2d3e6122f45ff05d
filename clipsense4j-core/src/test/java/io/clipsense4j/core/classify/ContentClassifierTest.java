/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.classify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import io.clipsense4j.core.api.ClassificationOptions;
import io.clipsense4j.core.api.Detector;
import io.clipsense4j.core.api.model.ClassificationOutput;
import io.clipsense4j.core.api.model.CodeLanguage;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Detection;
import io.clipsense4j.core.api.model.ExtractedItem;
import io.clipsense4j.core.api.model.Finding;
import io.clipsense4j.core.api.model.SplitEntry;
import io.clipsense4j.core.detect.PathProbe;
import io.clipsense4j.core.detect.UrlDetector;
import io.clipsense4j.core.encoding.EncodingResolver;
import io.clipsense4j.core.metadata.MetadataCodec;
import io.clipsense4j.core.metadata.model.EnvVarItem;
import io.clipsense4j.core.metadata.model.IpAddressItem;
import io.clipsense4j.core.metadata.model.MetadataDocument;
import io.clipsense4j.core.preset.DetectorConfig;
import io.clipsense4j.core.preset.DetectorRegistry;
import io.clipsense4j.core.report.Reporter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContentClassifierTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(2000), ZoneOffset.UTC);
    private static final String JWT = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9"
            + ".eyJzdWIiOiJ1c2VyLTQyIiwiaXNzIjoiaHR0cHM6Ly9pc3N1ZXIuZXhhbXBsZSIsImlhdCI6MTAwMCwiZXhwIjoyNTAwfQ"
            + ".c2lnbmF0dXJlLWJ5dGVz";

    @Mock
    private Reporter reporter;

    @Captor
    private ArgumentCaptor<List<Finding>> findings;

    private ContentClassifier classifier;

    @BeforeEach
    void setUp() {
        List<Detector<?>> detectors = new DetectorRegistry().build(null, new DetectorConfig(CLOCK, PathProbe.none()));
        classifier = new ContentClassifier(detectors, new EncodingResolver(), new MetadataCodec(), reporter);
    }

    @Test
    void classify_shouldBeDeterministic() {
        String text = "Contact alice@example.com or visit https://example.com today";

        assertThat(classifier.classify(text)).isEqualTo(classifier.classify(text));
    }

    @Test
    void classify_shouldTreatSingleAssignmentAsEnvVar() {
        ClassificationOutput out = classifier.classify("API_KEY=abc123");

        assertThat(out.primaryType()).isEqualTo(ContentType.ENV_VAR);
        assertThat(out.confidence()).isEqualTo(0.95);
        assertThat(out.metadata().env().block()).isFalse();
        assertThat(out.metadata().env().vars().get(0).key()).isEqualTo("API_KEY");
        assertThat(out.metadata().env().vars().get(0).value()).isEqualTo("abc123");
        assertThat(out.extractedItems()).isEmpty();
    }

    @Test
    void classify_shouldUnquoteExportedAssignment() {
        ClassificationOutput out = classifier.classify("export NAME=\"hello world\"");

        assertThat(out.primaryType()).isEqualTo(ContentType.ENV_VAR);
        assertThat(out.metadata().env().vars().get(0).exported()).isTrue();
        assertThat(out.metadata().env().vars().get(0).value()).isEqualTo("hello world");
    }

    @Test
    void classify_shouldSplitEnvironmentBlocks() {
        ClassificationOutput out = classifier.classify("FOO=bar\nexport BAZ=qux\n");

        assertThat(out.primaryType()).isEqualTo(ContentType.ENV_VAR_BLOCK);
        assertThat(out.isSplit()).isTrue();
        assertThat(out.extractedItems()).isEmpty();
        assertThat(out.splitEntries()).extracting(SplitEntry::content).containsExactly("FOO=bar", "export BAZ=qux");
        assertThat(out.splitEntries()).extracting(SplitEntry::contentType).containsOnly(ContentType.ENV_VAR);
        assertThat(out.splitEntries().get(1).metadataJson()).contains("\"key\":\"BAZ\"", "\"isExported\":true");
        assertThat(out.metadata().env().block()).isTrue();

        verify(reporter).report(findings.capture());
        assertThat(findings.getValue())
                .extracting(Finding::role)
                .containsExactly(Finding.Role.PRIMARY, Finding.Role.SPLIT, Finding.Role.SPLIT);
    }

    @Test
    void classify_shouldSplitAssignmentsMixedWithOtherLinesWhenNothingScoresHigher() {
        ClassificationOutput out = classifier.classify("FOO=bar\nBAZ=qux\nthis line is not an assignment");

        assertThat(out.primaryType()).isEqualTo(ContentType.ENV_VAR_BLOCK);
        assertThat(out.confidence()).isEqualTo(0.75);
        assertThat(out.splitEntries()).extracting(SplitEntry::content).containsExactly("FOO=bar", "BAZ=qux");
    }

    @Test
    void classify_shouldKeepSingleAssignmentAmongOtherLinesAboveText() {
        ClassificationOutput out = classifier.classify("FOO=bar\nsomething else here");

        assertThat(out.primaryType()).isEqualTo(ContentType.ENV_VAR);
        assertThat(out.confidence()).isEqualTo(0.75);
        assertThat(out.isSplit()).isFalse();
        assertThat(out.metadata().env().vars()).hasSize(1);
    }

    @Test
    void classify_shouldPreferCodeOverAnAssignmentInsidePython() {
        ClassificationOutput out = classifier.classify("import os\nDEBUG=True\n\ndef main():\n    print(os.getcwd())\n");

        assertThat(out.primaryType()).isEqualTo(ContentType.CODE);
        assertThat(out.metadata().code().get(0).language()).isEqualTo(CodeLanguage.PYTHON);
        assertThat(out.isSplit()).isFalse();
    }

    @Test
    void classify_shouldPreferCodeOverAnAssignmentInsideShellScript() {
        String script = "#!/bin/bash\nset -e\nPORT=8080\necho \"starting on $PORT\"\nnode server.js --port $PORT\n";

        ClassificationOutput out = classifier.classify(script);

        assertThat(out.primaryType()).isEqualTo(ContentType.CODE);
        assertThat(out.metadata().code().get(0).language()).isEqualTo(CodeLanguage.SHELL);
    }

    @Test
    void classify_shouldPreferProseOverAnAssignmentInsideReadme() {
        String readme = "The service reads its settings from the environment when it starts up.\n"
                + "PORT=8080\n"
                + "Change the value above if another process already uses that port on your machine.\n";

        ClassificationOutput out = classifier.classify(readme);

        assertThat(out.primaryType()).isEqualTo(ContentType.PROSE);
        assertThat(out.metadata().env().vars()).extracting(EnvVarItem::key).containsExactly("PORT");
    }

    @Test
    void classify_shouldExtractUrlFromSentence() {
        ClassificationOutput out = classifier.classify("See https://example.com");

        assertThat(out.primaryType()).isEqualTo(ContentType.URL);
        assertThat(out.extractedItems()).extracting(ExtractedItem::content).containsExactly("https://example.com");
        assertThat(out.extractedItems().get(0).metadataJson()).contains("\"urls\"").doesNotContain("\"emails\"");
    }

    @Test
    void classify_shouldNotExtractDetectionCoveringWholePayload() {
        ClassificationOutput out = classifier.classify("alice@example.com");

        assertThat(out.primaryType()).isEqualTo(ContentType.EMAIL);
        assertThat(out.extractedItems()).isEmpty();
        assertThat(out.metadata().emails()).hasSize(1);
    }

    @Test
    void classify_shouldKeepJwtOutOfApiKeys() {
        ClassificationOutput out = classifier.classify("Authorization: Bearer " + JWT);

        assertThat(out.primaryType()).isEqualTo(ContentType.JWT);
        assertThat(out.metadata().jwt()).hasSize(1);
        assertThat(out.metadata().jwt().get(0).expired()).isFalse();
        assertThat(out.metadata().jwt().get(0).claims().sub()).isEqualTo("user-42");
        assertThat(out.metadata().apiKeys()).isEmpty();
        assertThat(out.extractedItems()).extracting(ExtractedItem::contentType).containsExactly(ContentType.JWT);
    }

    @Test
    void classify_shouldFlagPrivateAddresses() {
        ClassificationOutput out = classifier.classify("Server at 192.168.1.10 and 8.8.8.8 responded");

        assertThat(out.primaryType()).isEqualTo(ContentType.IP_ADDRESS);
        assertThat(out.metadata().ipAddresses())
                .extracting(IpAddressItem::address, IpAddressItem::privateRange)
                .containsExactly(
                        tuple("192.168.1.10", true),
                        tuple("8.8.8.8", false));
    }

    @Test
    void classify_shouldClassifyDecodedPayload() {
        ClassificationOutput out = classifier.classify("https%3A%2F%2Fexample.com%2Fpath%3Fq%3D1");

        assertThat(out.primaryType()).isEqualTo(ContentType.URL);
        assertThat(out.decoded().steps()).containsExactly("url");
        assertThat(out.decoded().subject()).isEqualTo("https://example.com/path?q=1");
        assertThat(out.metadata().encoding().encoding()).isEqualTo("url");
        assertThat(out.metadata().urls().get(0).domain()).isEqualTo("example.com");
    }

    @Test
    void classify_shouldRecordEncodingEvenForPlainText() {
        ClassificationOutput out = classifier.classify("aGVsbG8gd29ybGQ=");

        assertThat(out.primaryType()).isEqualTo(ContentType.TEXT);
        assertThat(out.confidence()).isEqualTo(ContentClassifier.TEXT_CONFIDENCE);
        assertThat(out.metadata().encoding().decodedPreview()).isEqualTo("hello world");
        assertThat(out.metadataJson()).contains("\"base64\"");
    }

    @Test
    void classify_shouldRecogniseProse() {
        ClassificationOutput out = classifier.classify(
                "The quick brown fox jumps over the lazy dog near the river bank. "
                        + "Later that evening, everyone gathered around the fire to share stories.");

        assertThat(out.primaryType()).isEqualTo(ContentType.PROSE);
        assertThat(out.metadata().prose().wordCount()).isEqualTo(24);
    }

    @Test
    void classify_shouldRecogniseJson() {
        ClassificationOutput out = classifier.classify("{\"name\": \"clip\", \"count\": 2}");

        assertThat(out.primaryType()).isEqualTo(ContentType.CODE);
        assertThat(out.metadata().code().get(0).language()).isEqualTo(CodeLanguage.JSON);
    }

    @Test
    void classify_shouldStopAtPrimaryWhenExtractionIsOff() {
        String text = "Contact alice@example.com or visit https://example.com today";

        ClassificationOutput off = classifier.classify(text, ClassificationOptions.primaryOnly());
        ClassificationOutput on = classifier.classify(text);

        assertThat(off.primaryType()).isEqualTo(ContentType.EMAIL);
        assertThat(off.extractedItems()).isEmpty();
        assertThat(off.metadata().urls()).isEmpty();
        assertThat(off.metadataJson()).contains("\"emails\"").doesNotContain("\"urls\"");

        assertThat(on.primaryType()).isEqualTo(ContentType.EMAIL);
        assertThat(on.extractedItems())
                .extracting(ExtractedItem::content)
                .containsExactly("alice@example.com", "https://example.com");
    }

    @Test
    void classify_shouldInterleaveAndCapExtractedItems() {
        ClassificationOptions options = new ClassificationOptions(true, false, 2);

        ClassificationOutput out = classifier.classify("a@x.io b@y.io c@z.io https://example.com", options);

        assertThat(out.extractedItems())
                .extracting(ExtractedItem::contentType)
                .containsExactly(ContentType.EMAIL, ContentType.URL);
        assertThat(out.metadata().emails()).hasSize(3);
    }

    @Test
    void classify_shouldIsolateFailingDetector() {
        Detector<Detection.Email> broken = new Detector<>() {
            @Override
            public ContentType family() {
                return ContentType.EMAIL;
            }

            @Override
            public List<Detection.Email> detect(String text) {
                throw new IllegalStateException("boom");
            }
        };
        ContentClassifier isolated = new ContentClassifier(
                List.of(broken, new UrlDetector()), new EncodingResolver(), new MetadataCodec(), reporter);

        ClassificationOutput out = isolated.classify("See https://example.com");

        assertThat(out.primaryType()).isEqualTo(ContentType.URL);
        verify(reporter).detectorFailed(eq(ContentType.EMAIL), any(IllegalStateException.class));
    }

    @Test
    void classify_shouldIsolateDetectorThatFailsToLink() {
        Detector<Detection.Email> unlinked = new Detector<>() {
            @Override
            public ContentType family() {
                return ContentType.EMAIL;
            }

            @Override
            public List<Detection.Email> detect(String text) {
                throw new NoSuchMethodError("BufferRecycler.releaseToPool()");
            }
        };
        ContentClassifier isolated = new ContentClassifier(
                List.of(unlinked, new UrlDetector()), new EncodingResolver(), new MetadataCodec(), reporter);

        ClassificationOutput out = isolated.classify("See https://example.com");

        assertThat(out.primaryType()).isEqualTo(ContentType.URL);
        verify(reporter).detectorFailed(eq(ContentType.EMAIL), any(NoSuchMethodError.class));
    }

    @Test
    void classify_shouldSurviveReporterFailure() {
        doThrow(new IllegalStateException("down")).when(reporter).report(anyList());

        assertThat(classifier.classify("alice@example.com").primaryType()).isEqualTo(ContentType.EMAIL);
    }

    @Test
    void classify_shouldHandleBlankAndTinyInput() {
        assertThat(classifier.classify("   ")).isEqualTo(ClassificationOutput.unknown(""));
        assertThat(classifier.classify(null).primaryType()).isEqualTo(ContentType.UNKNOWN);

        ClassificationOutput tiny = classifier.classify(" x ");
        assertThat(tiny.primaryType()).isEqualTo(ContentType.UNKNOWN);
        assertThat(tiny.confidence()).isZero();
        assertThat(tiny.metadataJson()).isEmpty();
        assertThat(tiny.metadata()).isEqualTo(MetadataDocument.empty());

        assertThat(classifier.classify("ok").primaryType()).isEqualTo(ContentType.TEXT);
    }

    @Test
    void classify_shouldRejectNullOptions() {
        assertThatThrownBy(() -> classifier.classify("text", null)).isInstanceOf(NullPointerException.class);
    }
}
