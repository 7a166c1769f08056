package me.golemcore.contextengine.security;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.contextengine.domain.model.ContextSettings;
import me.golemcore.contextengine.domain.model.RedactionMode;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrubs secret-like substrings from text before it is persisted.
 *
 * <p>
 * Two independent passes:
 * <ul>
 * <li>Pattern pass - private keys, bearer tokens, JWTs, vendor key shapes,
 * password/key assignments and credentialed connection strings</li>
 * <li>Entropy pass - mixed letter/digit tokens whose Shannon entropy reaches
 * the configured threshold</li>
 * </ul>
 *
 * <p>
 * Only the secret span is replaced with {@link #PLACEHOLDER}; surrounding text
 * such as key names, user names and hosts is preserved. Redaction is
 * idempotent. The component is stateless and thread-safe.
 */
@Component
@Slf4j
public class SecretRedactor {

    public static final String PLACEHOLDER = "[REDACTED]";

    private static final Pattern ENTROPY_TOKEN = Pattern.compile("[A-Za-z0-9+/_-]+={0,2}");

    private static final List<SecretRule> RULES = List.of(
            new SecretRule("private_key", Pattern.compile(
                    "-----BEGIN [A-Z ]*PRIVATE KEY-----[\\s\\S]*?-----END [A-Z ]*PRIVATE KEY-----"), 0),
            new SecretRule("connection_string", Pattern.compile(
                    "\\b([a-zA-Z][a-zA-Z0-9+.-]*://[^\\s:/@]+:)([^\\s@/]+)(@)"), 2),
            new SecretRule("bearer", Pattern.compile(
                    "(?i)\\b(bearer\\s+)([A-Za-z0-9\\-._~+/]{8,}=*)"), 2),
            new SecretRule("jwt", Pattern.compile(
                    "\\beyJ[A-Za-z0-9_-]{5,}\\.[A-Za-z0-9_-]{5,}\\.[A-Za-z0-9_-]{5,}"), 0),
            new SecretRule("openai_style_key", Pattern.compile(
                    "\\b(?:sk|pk|rk)-(?:live-|test-|proj-|ant-)?[A-Za-z0-9_-]{16,}"), 0),
            new SecretRule("github_token", Pattern.compile(
                    "\\b(?:gh[pousr]_[A-Za-z0-9]{20,}|github_pat_[A-Za-z0-9_]{20,})"), 0),
            new SecretRule("aws_access_key", Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b"), 0),
            new SecretRule("slack_token", Pattern.compile("\\bxox[abprs]-[A-Za-z0-9-]{10,}"), 0),
            new SecretRule("google_api_key", Pattern.compile("\\bAIza[0-9A-Za-z_-]{35}"), 0),
            new SecretRule("assignment", Pattern.compile(
                    "(?i)((?<![A-Za-z0-9])(?:password|passwd|pwd|passphrase|secret|client[_-]?secret"
                            + "|api[_-]?key|apikey|access[_-]?key|access[_-]?token|auth[_-]?token|token"
                            + "|private[_-]?key)\\b[\"']?\\s*[:=]\\s*[\"']?)([^\\s\"',;]+)"),
                    2));

    public String redact(String text, ContextSettings settings) {
        ContextSettings effective = settings != null ? settings : ContextSettings.defaults();
        return redact(text, effective.getRedactionMode(), effective.getEntropyThreshold(),
                effective.getMinEntropyLength()).text();
    }

    public String redact(String text, RedactionMode mode) {
        ContextSettings defaults = ContextSettings.defaults();
        return redact(text, mode, defaults.getEntropyThreshold(), defaults.getMinEntropyLength()).text();
    }

    /**
     * Run the passes selected by {@code mode}.
     *
     * @throws RedactionException
     *             if a pass fails; the caller must drop the text
     */
    public RedactionResult redact(String text, RedactionMode mode, double entropyThreshold, int minEntropyLength) {
        if (text == null || text.isEmpty()) {
            return new RedactionResult(text == null ? "" : text, Map.of());
        }
        RedactionMode effectiveMode = mode != null ? mode : RedactionMode.BOTH;
        try {
            Map<String, Integer> counts = new HashMap<>();
            String result = text;
            if (effectiveMode.patternPass()) {
                for (SecretRule rule : RULES) {
                    result = applyRule(rule, result, counts);
                }
            }
            if (effectiveMode.entropyPass()) {
                result = applyEntropy(result, entropyThreshold, minEntropyLength, counts);
            }
            if (!counts.isEmpty()) {
                log.debug("[Redaction] Masked spans: {}", counts);
            }
            return new RedactionResult(result, Map.copyOf(counts));
        } catch (RuntimeException e) {
            throw new RedactionException("Redaction failed: " + e.getClass().getSimpleName(), e);
        }
    }

    /**
     * Shannon entropy in bits per character.
     */
    public static double shannonEntropy(String value) {
        if (value == null || value.isEmpty()) {
            return 0.0;
        }
        Map<Character, Integer> frequencies = new HashMap<>();
        for (int i = 0; i < value.length(); i++) {
            frequencies.merge(value.charAt(i), 1, Integer::sum);
        }
        double entropy = 0.0;
        double length = value.length();
        for (int count : frequencies.values()) {
            double p = count / length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    private String applyRule(SecretRule rule, String text, Map<String, Integer> counts) {
        Matcher matcher = rule.pattern().matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        int last = 0;
        while (matcher.find()) {
            int start = matcher.start(rule.secretGroup());
            int end = matcher.end(rule.secretGroup());
            if (start < 0) {
                continue;
            }
            String secret = text.substring(start, end);
            sb.append(text, last, start).append(PLACEHOLDER);
            last = end;
            if (!PLACEHOLDER.equals(secret)) {
                counts.merge(rule.name(), 1, Integer::sum);
            }
        }
        if (last == 0) {
            return text;
        }
        sb.append(text, last, text.length());
        return sb.toString();
    }

    private String applyEntropy(String text, double threshold, int minLength, Map<String, Integer> counts) {
        Matcher matcher = ENTROPY_TOKEN.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        int last = 0;
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() < minLength || !mixesLettersAndDigits(token)
                    || shannonEntropy(token) < threshold) {
                continue;
            }
            sb.append(text, last, matcher.start()).append(PLACEHOLDER);
            last = matcher.end();
            counts.merge("entropy", 1, Integer::sum);
        }
        if (last == 0) {
            return text;
        }
        sb.append(text, last, text.length());
        return sb.toString();
    }

    private boolean mixesLettersAndDigits(String token) {
        boolean letter = false;
        boolean digit = false;
        for (int i = 0; i < token.length() && !(letter && digit); i++) {
            char c = token.charAt(i);
            if (Character.isLetter(c)) {
                letter = true;
            } else if (Character.isDigit(c)) {
                digit = true;
            }
        }
        return letter && digit;
    }

    private record SecretRule(String name, Pattern pattern, int secretGroup) {
    }

    /**
     * Redacted text plus the number of masked spans per rule.
     */
    public record RedactionResult(String text, Map<String, Integer> maskedCounts) {

        public int totalMasked() {
            return maskedCounts.values().stream().mapToInt(Integer::intValue).sum();
        }
    }
}
