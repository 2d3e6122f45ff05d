/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.metadata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import lombok.Builder;

/**
 * Per-capture metadata, keyed by family. Absent families serialize to nothing; list order
 * is detection order. Immutable once built.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "all lists are immutable copies")
public record MetadataDocument(
        EncodingSection encoding,
        List<EmailItem> emails,
        List<UrlItem> urls,
        List<PhoneNumberItem> phoneNumbers,
        List<IpAddressItem> ipAddresses,
        List<UuidItem> uuids,
        List<HashItem> hashes,
        List<ApiKeyItem> apiKeys,
        List<JwtItem> jwt,
        EnvSection env,
        List<FilePathItem> filePaths,
        List<ShellCommandItem> shellCommands,
        List<CodeItem> code,
        ProseSection prose) {

    public MetadataDocument {
        emails = copy(emails);
        urls = copy(urls);
        phoneNumbers = copy(phoneNumbers);
        ipAddresses = copy(ipAddresses);
        uuids = copy(uuids);
        hashes = copy(hashes);
        apiKeys = copy(apiKeys);
        jwt = copy(jwt);
        filePaths = copy(filePaths);
        shellCommands = copy(shellCommands);
        code = copy(code);
        if (env != null && env.vars().isEmpty()) env = null;
    }

    public static MetadataDocument empty() {
        return builder().build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return encoding == null
                && emails.isEmpty()
                && urls.isEmpty()
                && phoneNumbers.isEmpty()
                && ipAddresses.isEmpty()
                && uuids.isEmpty()
                && hashes.isEmpty()
                && apiKeys.isEmpty()
                && jwt.isEmpty()
                && env == null
                && filePaths.isEmpty()
                && shellCommands.isEmpty()
                && code.isEmpty()
                && prose == null;
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
