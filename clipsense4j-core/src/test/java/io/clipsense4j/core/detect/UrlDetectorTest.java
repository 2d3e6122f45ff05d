/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import static org.assertj.core.api.Assertions.assertThat;

import io.clipsense4j.core.api.model.Detection;
import java.util.List;
import org.junit.jupiter.api.Test;

class UrlDetectorTest {

    private final UrlDetector detector = new UrlDetector();

    @Test
    void detect_shouldStripTrailingSentencePunctuation() {
        List<Detection.Url> found = detector.detect("See https://example.com.");

        assertThat(found).hasSize(1);
        Detection.Url url = found.get(0);
        assertThat(url.url()).isEqualTo("https://example.com");
        assertThat(url.domain()).isEqualTo("example.com");
        assertThat(url.category()).isEqualTo("other");
    }

    @Test
    void detect_shouldKeepBalancedClosingParenthesis() {
        List<Detection.Url> found = detector.detect("(see https://en.wikipedia.org/wiki/Java_(programming_language))");

        assertThat(found)
                .extracting(Detection.Url::url)
                .containsExactly("https://en.wikipedia.org/wiki/Java_(programming_language)");
    }

    @Test
    void detect_shouldOnlyAcceptWebAndFtpSchemes() {
        assertThat(detector.detect("ftp://files.example.org/a.txt")).hasSize(1);
        assertThat(detector.detect("mailto:someone@example.com ssh://host")).isEmpty();
    }

    @Test
    void detect_shouldDeduplicateIgnoringCase() {
        assertThat(detector.detect("https://A.com and https://a.com")).hasSize(1);
    }

    @Test
    void domainOf_shouldDropUserInfoAndPort() {
        assertThat(UrlDetector.domainOf("https://user:pw@Example.com:8080/x")).isEqualTo("example.com");
        assertThat(UrlDetector.domainOf("http://[::1]:8080/")).isEqualTo("::1");
    }

    @Test
    void categorize_shouldMapWellKnownDomains() {
        assertThat(UrlDetector.categorize("github.com")).isEqualTo("github");
        assertThat(UrlDetector.categorize("gist.github.com")).isEqualTo("github");
        assertThat(UrlDetector.categorize("docs.google.com")).isEqualTo("google-docs");
        assertThat(UrlDetector.categorize("www.google.com")).isEqualTo("google");
        assertThat(UrlDetector.categorize("developer.apple.com")).isEqualTo("apple-developer");
        assertThat(UrlDetector.categorize("youtu.be")).isEqualTo("youtube");
        assertThat(UrlDetector.categorize("x.com")).isEqualTo("x");
        assertThat(UrlDetector.categorize("web.mit.edu")).isEqualTo("education");
        assertThat(UrlDetector.categorize("www.irs.gov")).isEqualTo("government");
        assertThat(UrlDetector.categorize("notgithub.com")).isEqualTo("other");
    }
}
