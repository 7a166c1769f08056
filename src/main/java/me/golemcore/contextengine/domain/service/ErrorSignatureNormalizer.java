package me.golemcore.contextengine.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.contextengine.domain.model.ErrorSignature;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Reduces an error signature to a canonical form so that the same failure
 * seen twice yields the same pattern hash.
 */
@Component
public class ErrorSignatureNormalizer {

    static final int MAX_STACK_FRAMES = 5;

    private static final Pattern UUID = Pattern.compile(
            "\\b[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}\\b");
    private static final Pattern HEX = Pattern.compile("\\b0x[0-9a-f]+\\b");
    private static final Pattern PATH = Pattern.compile("(?:[a-z]:)?(?:[\\\\/][\\w.@-]+){2,}[\\\\/]?");
    private static final Pattern QUOTED = Pattern.compile("\"[^\"]*\"|'[^']*'|`[^`]*`");
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+(?:\\.\\d+)?\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_NUMBER = Pattern.compile(":\\d+(?::\\d+)?|\\bline \\d+");

    public ErrorSignature normalize(ErrorSignature signature) {
        if (signature == null) {
            return ErrorSignature.builder().category("").message("").build();
        }
        return ErrorSignature.builder()
                .category(normalizeCategory(signature.getCategory()))
                .message(normalizeMessage(signature.getMessage()))
                .contextHints(normalizeHints(signature.getContextHints()))
                .stackShape(normalizeStack(signature.getStackShape()))
                .build();
    }

    /**
     * SHA-256 hex of the normalised signature, scoped to a project.
     */
    public String hash(String projectId, ErrorSignature signature) {
        ErrorSignature normalized = normalize(signature);
        String canonical = String.join("|",
                projectId != null ? projectId : "",
                normalized.getCategory(),
                normalized.getMessage(),
                String.join(",", normalized.getContextHints()),
                String.join(">", normalized.getStackShape()));
        return sha256(canonical);
    }

    String normalizeCategory(String category) {
        return category == null ? "" : category.trim().toUpperCase(Locale.ROOT);
    }

    String normalizeMessage(String message) {
        if (message == null) {
            return "";
        }
        String text = message.toLowerCase(Locale.ROOT);
        text = UUID.matcher(text).replaceAll("<uuid>");
        text = HEX.matcher(text).replaceAll("<hex>");
        text = QUOTED.matcher(text).replaceAll("<str>");
        text = PATH.matcher(text).replaceAll("<path>");
        text = NUMBER.matcher(text).replaceAll("<n>");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private List<String> normalizeHints(List<String> hints) {
        if (hints == null || hints.isEmpty()) {
            return new ArrayList<>();
        }
        TreeSet<String> normalized = new TreeSet<>();
        hints.stream()
                .filter(Objects::nonNull)
                .map(hint -> WHITESPACE.matcher(hint.trim().toLowerCase(Locale.ROOT)).replaceAll(" "))
                .filter(hint -> !hint.isEmpty())
                .forEach(normalized::add);
        return new ArrayList<>(normalized);
    }

    private List<String> normalizeStack(List<String> frames) {
        List<String> normalized = new ArrayList<>();
        if (frames == null) {
            return normalized;
        }
        for (String frame : frames) {
            if (normalized.size() >= MAX_STACK_FRAMES) {
                break;
            }
            if (frame == null || frame.isBlank()) {
                continue;
            }
            String shape = LINE_NUMBER.matcher(frame.trim()).replaceAll("");
            normalized.add(WHITESPACE.matcher(shape).replaceAll(" ").trim());
        }
        return normalized;
    }

    private String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
