/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.classify;

import io.clipsense4j.core.api.model.DecodeResult;
import io.clipsense4j.core.api.model.Detection;
import io.clipsense4j.core.metadata.model.ApiKeyItem;
import io.clipsense4j.core.metadata.model.CodeItem;
import io.clipsense4j.core.metadata.model.EmailItem;
import io.clipsense4j.core.metadata.model.EncodingSection;
import io.clipsense4j.core.metadata.model.EnvSection;
import io.clipsense4j.core.metadata.model.EnvVarItem;
import io.clipsense4j.core.metadata.model.FilePathItem;
import io.clipsense4j.core.metadata.model.HashItem;
import io.clipsense4j.core.metadata.model.IpAddressItem;
import io.clipsense4j.core.metadata.model.JwtClaims;
import io.clipsense4j.core.metadata.model.JwtItem;
import io.clipsense4j.core.metadata.model.MetadataDocument;
import io.clipsense4j.core.metadata.model.PhoneNumberItem;
import io.clipsense4j.core.metadata.model.ProseSection;
import io.clipsense4j.core.metadata.model.ShellCommandItem;
import io.clipsense4j.core.metadata.model.UrlItem;
import io.clipsense4j.core.metadata.model.UuidItem;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Collects detections into a {@link MetadataDocument}. Items keep insertion order and are
 * de-duplicated case-insensitively within their family. One instance per document.
 */
final class MetadataAssembler {
    static final int PREVIEW_LENGTH = 200;

    private final List<EmailItem> emails = new ArrayList<>();
    private final List<UrlItem> urls = new ArrayList<>();
    private final List<PhoneNumberItem> phones = new ArrayList<>();
    private final List<IpAddressItem> ips = new ArrayList<>();
    private final List<UuidItem> uuids = new ArrayList<>();
    private final List<HashItem> hashes = new ArrayList<>();
    private final List<ApiKeyItem> apiKeys = new ArrayList<>();
    private final List<JwtItem> jwts = new ArrayList<>();
    private final List<EnvVarItem> envVars = new ArrayList<>();
    private final List<FilePathItem> filePaths = new ArrayList<>();
    private final List<ShellCommandItem> shellCommands = new ArrayList<>();
    private final List<CodeItem> code = new ArrayList<>();
    private final Set<String> seen = new HashSet<>();
    private ProseSection prose;
    private EncodingSection encoding;
    private boolean envBlock;

    MetadataAssembler addAll(List<? extends Detection> detections) {
        detections.forEach(this::add);
        return this;
    }

    MetadataAssembler add(Detection d) {
        if (d instanceof Detection.Prose p) {
            if (prose == null) prose = new ProseSection(p.wordCount(), p.estimatedReadingTimeSeconds(), p.confidence());
            return this;
        }
        String dedupKey = d.family().wireName() + ':' + d.value().toLowerCase(Locale.ROOT);
        if (!seen.add(dedupKey)) return this;

        if (d instanceof Detection.Email e) {
            emails.add(new EmailItem(e.email(), e.confidence()));
        } else if (d instanceof Detection.Url u) {
            urls.add(new UrlItem(u.url(), u.domain(), u.category(), u.confidence()));
        } else if (d instanceof Detection.PhoneNumber p) {
            phones.add(new PhoneNumberItem(p.number(), p.confidence()));
        } else if (d instanceof Detection.IpAddress ip) {
            ips.add(new IpAddressItem(
                    ip.address(),
                    ip.version(),
                    ip.privateRange(),
                    ip.loopback(),
                    ip.linkLocal(),
                    ip.multicast(),
                    ip.confidence()));
        } else if (d instanceof Detection.Uuid u) {
            uuids.add(new UuidItem(u.uuid(), u.version(), u.variant(), u.confidence()));
        } else if (d instanceof Detection.Hash h) {
            hashes.add(new HashItem(h.hash(), h.kind(), h.bits(), h.confidence()));
        } else if (d instanceof Detection.ApiKey k) {
            apiKeys.add(new ApiKeyItem(k.key(), k.provider(), k.likelyLive(), k.confidence()));
        } else if (d instanceof Detection.Jwt j) {
            jwts.add(new JwtItem(
                    j.token(),
                    j.headerJson(),
                    j.payloadJson(),
                    new JwtClaims(j.subject(), j.issuer(), j.issuedAt(), j.expiresAt()),
                    j.expired(),
                    j.confidence()));
        } else if (d instanceof Detection.EnvVar v) {
            envVars.add(new EnvVarItem(v.key(), v.envValue(), v.exported(), v.confidence()));
        } else if (d instanceof Detection.FilePath f) {
            filePaths.add(new FilePathItem(
                    f.path(), f.exists(), f.filename(), f.extension(), f.fileType(), f.mimeType(), f.confidence()));
        } else if (d instanceof Detection.ShellCommand c) {
            shellCommands.add(new ShellCommandItem(c.command(), c.executable(), c.confidence()));
        } else if (d instanceof Detection.Code c) {
            code.add(new CodeItem(c.language(), c.confidence()));
        }
        return this;
    }

    MetadataAssembler envBlock(boolean block) {
        this.envBlock = block;
        return this;
    }

    MetadataAssembler decoding(DecodeResult decoding) {
        if (decoding != null && decoding.isDecoded()) {
            List<String> steps = decoding.steps();
            String name = steps.size() == 1 ? steps.get(0) : EncodingSection.NESTED;
            encoding = new EncodingSection(name, steps, preview(decoding.decoded()));
        }
        return this;
    }

    MetadataDocument build() {
        return MetadataDocument.builder()
                .encoding(encoding)
                .emails(emails)
                .urls(urls)
                .phoneNumbers(phones)
                .ipAddresses(ips)
                .uuids(uuids)
                .hashes(hashes)
                .apiKeys(apiKeys)
                .jwt(jwts)
                .env(envVars.isEmpty() ? null : new EnvSection(envBlock, envVars))
                .filePaths(filePaths)
                .shellCommands(shellCommands)
                .code(code)
                .prose(prose)
                .build();
    }

    static String preview(String decoded) {
        if (decoded.length() <= PREVIEW_LENGTH) return decoded;
        int cut = Character.isHighSurrogate(decoded.charAt(PREVIEW_LENGTH - 1)) ? PREVIEW_LENGTH - 1 : PREVIEW_LENGTH;
        return decoded.substring(0, cut) + "...";
    }
}
