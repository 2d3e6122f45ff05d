/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.clipsense4j.core.api.Detector;
import io.clipsense4j.core.api.model.CodeLanguage;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Detection;
import io.clipsense4j.core.api.model.Span;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises source code and guesses its language. Fenced Markdown blocks are examined
 * one by one; otherwise the whole text is a single candidate. JSON, HTML and CSS are
 * strong shapes; everything else needs some code signal before languages are scored.
 */
public final class CodeDetector implements Detector<Detection.Code> {
    static final double THRESHOLD = 0.6;

    private static final Pattern FENCE = Pattern.compile("```([A-Za-z0-9_+\\-]+)?\\n([\\s\\S]*?)```");
    private static final Pattern CSS_RULE =
            Pattern.compile("[^{}();=]+\\{[^{}]*?[\\w-]+\\s*:[^{};]+;[^{}]*\\}", Pattern.DOTALL);
    private static final Pattern YAML_KEY = Pattern.compile("^-?\\s*[\\w.\\-\"']+:(\\s.*)?$");
    private static final List<String> CODE_TOKENS =
            List.of("{", "}", ";", "=>", "==", "!=", "()", "[]", ":=", "::", "#include", "import ");

    private static final ObjectMapper MAPPER =
            JsonMapper.builder().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).build();

    private record Candidate(String code, Span span) {}

    private record Score(CodeLanguage language, double confidence) {}

    @Override
    public ContentType family() {
        return ContentType.CODE;
    }

    @Override
    public List<Detection.Code> detect(String s) {
        if (s == null || s.isBlank()) return List.of();
        Set<String> seen = new HashSet<>();
        List<Detection.Code> out = new ArrayList<>();
        for (Candidate c : candidates(s)) {
            if (c.code().isEmpty() || !seen.add(c.code())) continue;
            Score score = classify(c.code());
            if (score.confidence() < THRESHOLD) continue;
            out.add(new Detection.Code(c.span(), c.code(), score.language(), score.confidence()));
        }
        return List.copyOf(out);
    }

    private static List<Candidate> candidates(String s) {
        Matcher m = FENCE.matcher(s);
        List<Candidate> blocks = new ArrayList<>();
        while (m.find()) blocks.add(trimmed(s, m.start(2), m.end(2)));
        if (!blocks.isEmpty()) return blocks;
        return List.of(trimmed(s, 0, s.length()));
    }

    private static Candidate trimmed(String s, int start, int end) {
        while (start < end && Character.isWhitespace(s.charAt(start))) start++;
        while (end > start && Character.isWhitespace(s.charAt(end - 1))) end--;
        return new Candidate(s.substring(start, end), new Span(start, end));
    }

    static Score classify(String code) {
        if (isJson(code)) return new Score(CodeLanguage.JSON, 0.95);
        double html = htmlConfidence(code);
        if (html >= 0.9) return new Score(CodeLanguage.HTML, html);
        if (CSS_RULE.matcher(code).find()) return new Score(CodeLanguage.CSS, 0.9);
        if (!looksLikeCode(code)) return new Score(CodeLanguage.UNKNOWN, 0.0);

        List<Score> scores = List.of(
                new Score(CodeLanguage.SWIFT, swift(code)),
                new Score(CodeLanguage.PYTHON, python(code)),
                new Score(CodeLanguage.TYPESCRIPT, typeScript(code)),
                new Score(CodeLanguage.JAVASCRIPT, javaScript(code)),
                new Score(CodeLanguage.GO, go(code)),
                new Score(CodeLanguage.RUST, rust(code)),
                new Score(CodeLanguage.JAVA, java(code)),
                new Score(CodeLanguage.C_CPP, cCpp(code)),
                new Score(CodeLanguage.RUBY, ruby(code)),
                new Score(CodeLanguage.SQL, sql(code)),
                new Score(CodeLanguage.YAML, yaml(code)),
                new Score(CodeLanguage.SHELL, shell(code)));
        Score best = scores.get(0);
        for (Score sc : scores) {
            if (sc.confidence() > best.confidence()) best = sc;
        }
        return best;
    }

    private static boolean looksLikeCode(String s) {
        if (s.contains("\n")) return true;
        for (String t : CODE_TOKENS) {
            if (s.contains(t)) return true;
        }
        return false;
    }

    private static boolean isJson(String s) {
        if (!(s.startsWith("{") || s.startsWith("["))) return false;
        try {
            JsonNode node = MAPPER.readTree(s);
            return node != null && (node.isObject() || node.isArray());
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private static double htmlConfidence(String s) {
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.contains("<!doctype html") || lower.contains("<html")) return 0.95;
        if (lower.contains("<div") || lower.contains("<span") || lower.contains("</")) return 0.9;
        return 0.0;
    }

    private static double swift(String s) {
        double score = 0.0;
        if (s.contains("import SwiftUI") || s.contains("import Foundation")) score += 0.6;
        if (s.contains("struct ") || s.contains("enum ") || s.contains("protocol ")) score += 0.2;
        if (s.contains("func ")) score += 0.2;
        if (s.contains("let ") || s.contains("var ")) score += 0.1;
        if (s.contains(": ") && (s.contains("String") || s.contains("Int") || s.contains("Bool"))) score += 0.1;
        return Math.min(0.95, score);
    }

    private static double python(String s) {
        double score = 0.0;
        if (s.contains("def ")) score += 0.4;
        if (s.contains("import ") || s.contains("from ")) score += 0.2;
        if (s.contains("elif ") || s.contains("None") || s.contains("self")) score += 0.2;
        if (s.contains(":\n")) score += 0.2;
        if (s.contains("    ")) score += 0.1;
        return Math.min(0.95, score);
    }

    private static double javaScript(String s) {
        double score = 0.0;
        if (s.contains("console.")) score += 0.2;
        if (s.contains("const ") || s.contains("let ") || s.contains("var ")) score += 0.2;
        if (s.contains("function ")) score += 0.2;
        if (s.contains("=>")) score += 0.2;
        if (s.contains("export ") || s.contains("import ")) score += 0.1;
        return Math.min(0.9, score);
    }

    private static double typeScript(String s) {
        double score = javaScript(s) * 0.8;
        if (s.contains("interface ") || s.contains("type ")) score += 0.4;
        if (s.contains(": number") || s.contains(": string") || s.contains(": boolean")) score += 0.3;
        if (s.contains(" as ")) score += 0.1;
        return Math.min(0.95, score);
    }

    private static double go(String s) {
        double score = 0.0;
        if (s.contains("package ")) score += 0.4;
        if (s.contains("func ")) score += 0.2;
        if (s.contains(":=")) score += 0.2;
        if (s.contains("import ")) score += 0.1;
        if (s.contains("fmt.")) score += 0.1;
        return Math.min(0.95, score);
    }

    private static double rust(String s) {
        double score = 0.0;
        if (s.contains("fn ")) score += 0.3;
        if (s.contains("let mut") || s.contains("impl ")) score += 0.2;
        if (s.contains("use ")) score += 0.1;
        if (s.contains("::")) score += 0.2;
        if (s.contains("println!")) score += 0.3;
        return Math.min(0.95, score);
    }

    private static double java(String s) {
        double score = 0.0;
        if (s.contains("public class") || s.contains("public final class")) score += 0.5;
        if (s.contains("static void main")) score += 0.3;
        if (s.contains("System.out")) score += 0.2;
        if (s.contains("@Override") || s.contains("private final ")) score += 0.2;
        return Math.min(0.95, score);
    }

    private static double cCpp(String s) {
        double score = 0.0;
        if (s.contains("#include")) score += 0.6;
        if (s.contains("int main")) score += 0.2;
        if (s.contains("std::")) score += 0.2;
        return Math.min(0.95, score);
    }

    private static double ruby(String s) {
        double score = 0.0;
        if (s.contains("def ")) score += 0.3;
        if (s.contains("\nend") || s.endsWith("end")) score += 0.3;
        if (s.contains("puts ")) score += 0.2;
        if (s.contains("require ")) score += 0.1;
        return Math.min(0.9, score);
    }

    private static double sql(String s) {
        String upper = s.toUpperCase(Locale.ROOT);
        double score = 0.0;
        if (upper.contains("SELECT ")) score += 0.4;
        if (upper.contains("FROM ")) score += 0.2;
        if (upper.contains("WHERE ")) score += 0.2;
        if (upper.contains("INSERT ") || upper.contains("UPDATE ") || upper.contains("DELETE ")) score += 0.2;
        if (s.contains(";")) score += 0.1;
        return Math.min(0.95, score);
    }

    private static double yaml(String s) {
        String[] lines = s.split("\n");
        int nonEmpty = 0;
        int keyValue = 0;
        boolean list = false;
        for (String raw : lines) {
            String l = raw.strip();
            if (l.isEmpty() || l.startsWith("#")) continue;
            nonEmpty++;
            if (l.startsWith("- ")) list = true;
            if (YAML_KEY.matcher(l).matches() && !l.contains("{") && !l.contains("}")) keyValue++;
        }
        if (nonEmpty < 2 || keyValue < 2) return 0.0;
        return list ? 0.9 : 0.8;
    }

    private static double shell(String s) {
        double score = 0.0;
        if (s.startsWith("#!/")) score += 0.5;
        if (s.contains("export ")) score += 0.4;
        if (s.contains("set -e")) score += 0.2;
        if (s.contains("$(") || s.contains("`")) score += 0.1;
        if (s.contains("cd ") || s.contains("echo ")) score += 0.2;
        return Math.min(0.9, score);
    }
}
