/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import static org.assertj.core.api.Assertions.assertThat;

import io.clipsense4j.core.api.model.CodeLanguage;
import io.clipsense4j.core.api.model.Detection;
import java.util.List;
import org.junit.jupiter.api.Test;

class CodeDetectorTest {

    private final CodeDetector detector = new CodeDetector();

    @Test
    void detect_shouldRecogniseJson() {
        Detection.Code code = detector.detect("{\"name\": \"clip\", \"tags\": [1, 2]}").get(0);

        assertThat(code.language()).isEqualTo(CodeLanguage.JSON);
        assertThat(code.confidence()).isEqualTo(0.95);
    }

    @Test
    void detect_shouldRecogniseHtml() {
        assertThat(detector.detect("<div class=\"x\">hi</div>"))
                .extracting(Detection.Code::language)
                .containsExactly(CodeLanguage.HTML);
    }

    @Test
    void detect_shouldRecogniseCss() {
        assertThat(detector.detect("body { color: red; }"))
                .extracting(Detection.Code::language)
                .containsExactly(CodeLanguage.CSS);
    }

    @Test
    void detect_shouldScoreJavaClasses() {
        String source = "public class Main {\n"
                + "    public static void main(String[] args) {\n"
                + "        System.out.println(\"hi\");\n"
                + "    }\n"
                + "}";

        Detection.Code code = detector.detect(source).get(0);

        assertThat(code.language()).isEqualTo(CodeLanguage.JAVA);
        assertThat(code.confidence()).isEqualTo(0.95);
    }

    @Test
    void detect_shouldExamineFencedBlocks() {
        String text = "Here:\n```python\ndef greet(name):\n    return None\n```";

        List<Detection.Code> found = detector.detect(text);

        assertThat(found).hasSize(1);
        Detection.Code code = found.get(0);
        assertThat(code.code()).isEqualTo("def greet(name):\n    return None");
        assertThat(code.language()).isEqualTo(CodeLanguage.PYTHON);
        assertThat(code.confidence()).isGreaterThanOrEqualTo(CodeDetector.THRESHOLD);
        assertThat(text.substring(code.span().start(), code.span().end())).isEqualTo(code.code());
    }

    @Test
    void detect_shouldIgnorePlainWords() {
        assertThat(detector.detect("just some words here")).isEmpty();
        assertThat(detector.detect("   ")).isEmpty();
    }
}
