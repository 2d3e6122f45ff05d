/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import static org.assertj.core.api.Assertions.assertThat;

import io.clipsense4j.core.api.model.Detection;
import java.util.List;
import org.junit.jupiter.api.Test;

class ShellCommandDetectorTest {

    private final ShellCommandDetector detector = new ShellCommandDetector();

    @Test
    void detect_shouldStripDollarPrompt() {
        List<Detection.ShellCommand> found = detector.detect("$ git commit -m 'fix'");

        assertThat(found).hasSize(1);
        assertThat(found.get(0).command()).isEqualTo("git commit -m 'fix'");
        assertThat(found.get(0).executable()).isEqualTo("git");
        assertThat(found.get(0).confidence()).isEqualTo(1.0);
    }

    @Test
    void detect_shouldScorePipelines() {
        assertThat(detector.detect("ls -la | grep foo"))
                .extracting(Detection.ShellCommand::command)
                .containsExactly("ls -la | grep foo");
    }

    @Test
    void detect_shouldStripUserHostPrompt() {
        Detection.ShellCommand cmd = detector.detect("user@host:~$ npm install").get(0);

        assertThat(cmd.command()).isEqualTo("npm install");
        assertThat(cmd.executable()).isEqualTo("npm");
        assertThat(cmd.confidence()).isGreaterThanOrEqualTo(ShellCommandDetector.THRESHOLD);
    }

    @Test
    void detect_shouldReportEachLineOfAScript() {
        String script = "cd /tmp\nls -la\ngit status";

        assertThat(detector.detect(script))
                .extracting(d -> script.substring(d.span().start(), d.span().end()))
                .containsExactly("cd /tmp", "ls -la", "git status");
    }

    @Test
    void detect_shouldIgnoreSentences() {
        assertThat(detector.detect("Please remember to buy milk and eggs today.")).isEmpty();
    }

    @Test
    void detect_shouldIgnoreAStrayCommandInsideNotes() {
        assertThat(detector.detect("Meeting notes for today\ngit status\nRemember the milk please")).isEmpty();
    }

    @Test
    void detect_shouldIgnoreVeryLongText() {
        assertThat(detector.detect("ls -la ".repeat(200))).isEmpty();
    }
}
