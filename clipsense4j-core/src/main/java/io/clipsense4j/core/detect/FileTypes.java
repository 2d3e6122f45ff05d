/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import io.clipsense4j.core.api.model.FileType;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Extension lookups for file category and MIME type. */
final class FileTypes {
    private FileTypes() {}

    private static final Set<String> IMAGE = Set.of(
            "png", "jpg", "jpeg", "gif", "bmp", "tiff", "tif", "webp", "heic", "heif",
            "svg", "ico", "icns", "raw", "cr2", "nef", "arw", "dng", "psd", "ai", "eps");
    private static final Set<String> VIDEO = Set.of(
            "mp4", "mov", "avi", "mkv", "wmv", "flv", "webm", "m4v", "mpeg", "mpg",
            "3gp", "ogv", "ts", "mts", "m2ts");
    private static final Set<String> AUDIO = Set.of(
            "mp3", "wav", "aac", "flac", "ogg", "wma", "m4a", "aiff", "aif", "opus", "mid", "midi");
    private static final Set<String> DOCUMENT = Set.of(
            "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "odt", "ods", "odp",
            "rtf", "txt", "md", "markdown", "tex", "pages", "numbers", "key",
            "epub", "mobi", "azw", "csv");
    private static final Set<String> CODE = Set.of(
            "swift", "py", "js", "jsx", "tsx", "java", "kt", "c", "cpp", "h", "hpp",
            "cs", "go", "rs", "rb", "php", "pl", "sh", "bash", "zsh", "fish",
            "html", "htm", "css", "scss", "sass", "less", "json", "xml", "yaml", "yml",
            "toml", "ini", "conf", "config", "sql", "graphql", "proto", "thrift",
            "r", "m", "mm", "scala", "clj", "cljs", "erl", "ex", "exs", "hs", "ml",
            "vue", "svelte", "astro");
    private static final Set<String> ARCHIVE = Set.of(
            "zip", "tar", "gz", "bz2", "xz", "7z", "rar", "dmg", "iso", "pkg", "deb", "rpm");
    private static final Set<String> DATA = Set.of("db", "sqlite", "sqlite3", "mdb", "accdb", "plist", "dat");
    private static final Set<String> EXECUTABLE = Set.of("app", "exe", "msi", "bin", "command", "jar", "war", "apk", "ipa");
    private static final Set<String> FONT = Set.of("ttf", "otf", "woff", "woff2", "eot");

    private static final Map<String, String> MIME = Map.ofEntries(
            Map.entry("png", "image/png"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("gif", "image/gif"),
            Map.entry("bmp", "image/bmp"),
            Map.entry("tiff", "image/tiff"),
            Map.entry("tif", "image/tiff"),
            Map.entry("webp", "image/webp"),
            Map.entry("heic", "image/heic"),
            Map.entry("heif", "image/heif"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("ico", "image/x-icon"),
            Map.entry("psd", "image/vnd.adobe.photoshop"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("mov", "video/quicktime"),
            Map.entry("avi", "video/x-msvideo"),
            Map.entry("mkv", "video/x-matroska"),
            Map.entry("webm", "video/webm"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("wav", "audio/wav"),
            Map.entry("aac", "audio/aac"),
            Map.entry("flac", "audio/flac"),
            Map.entry("ogg", "audio/ogg"),
            Map.entry("m4a", "audio/mp4"),
            Map.entry("pdf", "application/pdf"),
            Map.entry("doc", "application/msword"),
            Map.entry("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
            Map.entry("xls", "application/vnd.ms-excel"),
            Map.entry("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
            Map.entry("ppt", "application/vnd.ms-powerpoint"),
            Map.entry("pptx", "application/vnd.openxmlformats-officedocument.presentationml.presentation"),
            Map.entry("txt", "text/plain"),
            Map.entry("md", "text/markdown"),
            Map.entry("csv", "text/csv"),
            Map.entry("html", "text/html"),
            Map.entry("css", "text/css"),
            Map.entry("js", "application/javascript"),
            Map.entry("json", "application/json"),
            Map.entry("xml", "application/xml"),
            Map.entry("yaml", "application/x-yaml"),
            Map.entry("yml", "application/x-yaml"),
            Map.entry("zip", "application/zip"),
            Map.entry("tar", "application/x-tar"),
            Map.entry("gz", "application/gzip"),
            Map.entry("7z", "application/x-7z-compressed"),
            Map.entry("rar", "application/vnd.rar"),
            Map.entry("dmg", "application/x-apple-diskimage"));

    static FileType classify(String extension) {
        if (extension == null) return FileType.OTHER;
        String ext = extension.toLowerCase(Locale.ROOT);
        if (IMAGE.contains(ext)) return FileType.IMAGE;
        if (VIDEO.contains(ext)) return FileType.VIDEO;
        if (AUDIO.contains(ext)) return FileType.AUDIO;
        if (DOCUMENT.contains(ext)) return FileType.DOCUMENT;
        if (CODE.contains(ext)) return FileType.CODE;
        if (ARCHIVE.contains(ext)) return FileType.ARCHIVE;
        if (DATA.contains(ext)) return FileType.DATA;
        if (EXECUTABLE.contains(ext)) return FileType.EXECUTABLE;
        if (FONT.contains(ext)) return FileType.FONT;
        return FileType.OTHER;
    }

    static String mimeType(String extension) {
        return extension == null ? null : MIME.get(extension.toLowerCase(Locale.ROOT));
    }
}
