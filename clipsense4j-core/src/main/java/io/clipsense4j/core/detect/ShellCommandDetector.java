/*
 * Copyright (c) 2026 Clipsense4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.clipsense4j.core.detect;

import io.clipsense4j.core.api.Detector;
import io.clipsense4j.core.api.model.ContentType;
import io.clipsense4j.core.api.model.Detection;
import io.clipsense4j.core.api.model.Span;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores each line as a shell command: a known executable, shell operators (pipes,
 * chaining, redirects, substitutions), flags and a familiar sub-command all add up.
 * Prompts such as {@code $ } or {@code user@host:~$ } are stripped from the command.
 */
public final class ShellCommandDetector implements Detector<Detection.ShellCommand> {
    static final double THRESHOLD = 0.5;
    private static final int MAX_LENGTH = 1000;

    private static final Set<String> COMMANDS = Set.copyOf(List.of(
            // files
            "ls", "cd", "pwd", "mkdir", "rmdir", "rm", "cp", "mv", "touch", "cat", "less", "more", "head", "tail",
            "find", "locate", "which", "whereis", "file", "stat", "chmod", "chown", "chgrp", "ln", "readlink",
            // text
            "grep", "egrep", "fgrep", "rg", "ag", "sed", "awk", "gawk", "sort", "uniq", "wc", "cut", "tr", "diff",
            "patch", "jq", "yq", "xq",
            // system
            "sudo", "su", "ps", "top", "htop", "btop", "kill", "killall", "pkill", "bg", "fg", "jobs", "nohup",
            "screen", "tmux", "systemctl", "service", "launchctl", "defaults", "open", "pbcopy", "pbpaste",
            // network
            "curl", "wget", "http", "httpie", "ssh", "scp", "sftp", "rsync", "ping", "netstat", "ss", "ifconfig",
            "ip", "nc", "netcat", "telnet", "dig", "nslookup", "host", "traceroute", "mtr", "nmap", "lsof",
            // package managers
            "apt", "apt-get", "dpkg", "yum", "dnf", "rpm", "pacman", "brew", "port",
            "npm", "npx", "yarn", "pnpm", "bun", "deno", "pip", "pip3", "pipx", "pipenv", "poetry", "uv", "conda",
            "gem", "bundle", "bundler", "cargo", "rustup", "go", "gofmt", "composer", "pod", "carthage",
            "swift", "swiftc", "xcodebuild", "xcrun", "xcode-select", "mix", "hex", "rebar3",
            "stack", "cabal", "ghc", "dotnet", "nuget", "maven", "mvn", "gradle", "gradlew",
            // version control
            "git", "gh", "hub", "svn", "hg", "fossil",
            // containers and cloud
            "docker", "docker-compose", "podman", "buildah", "skopeo", "kubectl", "k9s", "helm", "minikube", "kind",
            "vagrant", "packer", "terraform", "terragrunt", "pulumi", "cdktf",
            "aws", "gcloud", "az", "doctl", "flyctl", "vercel", "netlify", "heroku", "railway",
            // build
            "make", "cmake", "ninja", "meson", "bazel", "buck", "ant", "sbt", "task", "just", "mise", "asdf",
            // shells and runtimes
            "bash", "sh", "zsh", "fish", "dash", "ksh", "csh", "tcsh",
            "python", "python3", "python2", "ipython", "node", "nodejs", "ts-node", "tsx",
            "ruby", "irb", "rails", "rake", "perl", "php", "lua", "r", "rscript",
            "java", "javac", "jar", "kotlin", "kotlinc", "scala", "scalac", "erl", "elixir", "iex",
            "ghci", "runhaskell",
            // editors
            "vim", "nvim", "vi", "nano", "emacs", "code", "subl", "atom", "idea", "webstorm", "pycharm",
            // test and lint
            "jest", "vitest", "mocha", "pytest", "rspec", "phpunit",
            "eslint", "prettier", "black", "flake8", "pylint", "rubocop", "shellcheck", "hadolint",
            // misc
            "echo", "printf", "env", "export", "source", "alias", "unalias", "history", "man", "info", "tldr",
            "xargs", "tee", "time", "timeout", "watch", "cron", "crontab",
            "tar", "gzip", "gunzip", "bzip2", "xz", "zip", "unzip", "7z", "rar",
            "openssl", "base64", "md5", "sha256sum", "shasum", "date", "cal", "bc", "expr",
            "seq", "yes", "true", "false", "test", "sleep", "whoami", "id", "groups", "hostname", "uname",
            "df", "du", "free", "uptime", "w", "who", "last", "clear", "reset", "tput",
            "set", "unset", "declare", "local", "readonly",
            "if", "then", "else", "fi", "for", "do", "done", "while", "until", "case", "esac",
            "ffmpeg", "ffprobe", "imagemagick", "convert", "magick",
            "fzf", "bat", "exa", "eza", "fd", "sd", "delta", "difft", "hyperfine", "tokei", "dust", "duf", "procs",
            "btm", "bandwhich", "grex"));

    private static final Set<String> SUBCOMMANDS = Set.copyOf(List.of(
            "install", "uninstall", "update", "upgrade", "add", "remove", "rm", "del", "delete",
            "init", "create", "new", "build", "run", "start", "stop", "restart", "test", "dev", "serve",
            "push", "pull", "fetch", "clone", "commit", "checkout", "branch", "merge", "rebase", "stash", "log",
            "diff", "status", "exec", "attach", "logs", "ps", "images", "volume", "network", "compose",
            "apply", "get", "describe", "edit", "login", "logout", "whoami", "config", "set", "list", "show",
            "info", "version", "help"));

    private record Weighted(Pattern pattern, double weight) {
        Weighted(String regex, double weight) {
            this(Pattern.compile(regex), weight);
        }
    }

    private static final List<Weighted> SHELL_PATTERNS = List.of(
            new Weighted("^\\s*\\$\\s+", 0.95),
            new Weighted("^\\s*>\\s+", 0.8),
            new Weighted("^#!", 0.99),
            new Weighted("\\|\\s*\\w+", 0.9),
            new Weighted("\\s&&\\s", 0.9),
            new Weighted("\\s\\|\\|\\s", 0.9),
            new Weighted("\\s*;\\s*\\w+", 0.8),
            new Weighted(">\\s*/dev/null", 0.95),
            new Weighted("2>&1", 0.95),
            new Weighted(">\\s*\\S+", 0.7),
            new Weighted("<\\s*\\S+", 0.7),
            new Weighted("\\$\\([^)]+\\)", 0.9),
            new Weighted("`[^`]+`", 0.85),
            new Weighted("\\$\\{\\w+[^}]*\\}", 0.85),
            new Weighted("\\$[A-Z_][A-Z0-9_]*", 0.7));

    private static final List<Weighted> FLAG_PATTERNS = List.of(
            new Weighted("\\s--[a-z][-a-z0-9]*", 0.6),
            new Weighted("\\s--[a-z][-a-z0-9]*=", 0.7),
            new Weighted("\\s-[a-zA-Z]\\s", 0.4),
            new Weighted("\\s-[a-zA-Z]$", 0.4),
            new Weighted("\\s-[a-zA-Z][a-zA-Z]+", 0.5));

    private static final Pattern PROMPT = Pattern.compile("^\\s*[$>%#]\\s+");
    private static final Pattern USER_HOST_PROMPT =
            Pattern.compile("^[\\w.\\-]+@[\\w.\\-]+(?::[^\\s$#%>]*)?[$#%>]\\s+");
    private static final Pattern PATH_ARG = Pattern.compile("\\s\\S+/\\S+");
    private static final Pattern OPERATORS = Pattern.compile("\\||&&|\\$\\(|`|>|<|\\s-{1,2}[A-Za-z]");
    private static final Pattern WORDS = Pattern.compile("\\s+");

    @Override
    public ContentType family() {
        return ContentType.SHELL_COMMAND;
    }

    @Override
    public List<Detection.ShellCommand> detect(String s) {
        if (s == null || s.isBlank()) return List.of();
        String trimmed = s.strip();
        if (trimmed.length() > MAX_LENGTH || looksLikeProse(trimmed)) return List.of();
        int offset = s.indexOf(trimmed);

        List<Detection.ShellCommand> found = new ArrayList<>();
        int lines = 0;
        int pos = 0;
        while (pos <= trimmed.length()) {
            int nl = trimmed.indexOf('\n', pos);
            int end = nl < 0 ? trimmed.length() : nl;
            String raw = trimmed.substring(pos, end);
            String line = raw.strip();
            if (!line.isEmpty() && !line.startsWith("#")) {
                lines++;
                int start = offset + pos + raw.indexOf(line.charAt(0));
                scoreLine(line, new Span(start, start + line.length())).ifPresent(found::add);
            }
            if (nl < 0) break;
            pos = nl + 1;
        }

        if (found.isEmpty()) {
            return scoreLine(trimmed, new Span(offset, offset + trimmed.length()))
                    .map(List::of)
                    .orElse(List.of());
        }
        // a stray command-looking line inside ordinary text does not make it a script
        return (double) found.size() / Math.max(lines, 1) >= 0.5 ? List.copyOf(found) : List.of();
    }

    private static boolean looksLikeProse(String text) {
        long periods = text.chars().filter(c -> c == '.').count();
        int words = WORDS.split(text).length;
        return periods > 2 && (double) periods / words > 0.1;
    }

    /** A capitalised, punctuated sentence without any shell operator is not a command. */
    private static boolean looksLikeSentence(String line, int words) {
        char first = line.charAt(0);
        char last = line.charAt(line.length() - 1);
        return words >= 5
                && Character.isUpperCase(first)
                && (last == '.' || last == '!' || last == '?')
                && !OPERATORS.matcher(line).find();
    }

    private static Optional<Detection.ShellCommand> scoreLine(String line, Span span) {
        if (line.length() < 2) return Optional.empty();

        String command = line;
        Matcher prompt = PROMPT.matcher(command);
        if (prompt.find()) command = command.substring(prompt.end());
        Matcher userHost = USER_HOST_PROMPT.matcher(command);
        if (userHost.find()) command = command.substring(userHost.end());
        command = command.strip();
        if (command.isEmpty()) return Optional.empty();

        String[] words = WORDS.split(command);
        if (looksLikeSentence(command, words.length)) return Optional.empty();

        String executable = words[0];
        if (executable.contains("/")) {
            String[] parts = executable.split("/");
            executable = parts.length == 0 ? executable : parts[parts.length - 1];
        }
        executable = executable.toLowerCase(Locale.ROOT);

        double confidence = 0.0;
        if (COMMANDS.contains(executable)) confidence += 0.65;
        for (Weighted w : SHELL_PATTERNS) {
            if (w.pattern().matcher(line).find()) confidence += w.weight() * 0.4;
        }
        double flags = 0.0;
        for (Weighted w : FLAG_PATTERNS) {
            if (w.pattern().matcher(command).find()) flags += w.weight();
        }
        confidence += Math.min(flags, 0.4);
        if (words.length >= 2) {
            if (command.contains(" -") || PATH_ARG.matcher(command).find()) confidence += 0.15;
            if (SUBCOMMANDS.contains(words[1].toLowerCase(Locale.ROOT))) confidence += 0.2;
        }
        confidence = Math.min(confidence, 1.0);
        if (confidence < THRESHOLD) return Optional.empty();
        return Optional.of(new Detection.ShellCommand(span, command, executable, confidence));
    }
}
