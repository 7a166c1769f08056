package me.golemcore.contextengine.adapter.outbound.content;

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
import me.golemcore.contextengine.infrastructure.config.ContextEngineProperties;
import me.golemcore.contextengine.port.outbound.PackageContentPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Resolves package content pointers against the configured content root.
 * Pointers that escape the root are refused and oversized bodies are cut at
 * the configured byte limit.
 */
@Component
@Slf4j
public class FileSystemPackageContentAdapter implements PackageContentPort {

    private final Path contentRoot;
    private final long maxContentBytes;

    public FileSystemPackageContentAdapter(ContextEngineProperties properties) {
        ContextEngineProperties.RetrievalProperties retrieval = properties.getRetrieval();
        String root = retrieval.getContentRoot() != null ? retrieval.getContentRoot() : ".";
        this.contentRoot = Paths.get(root.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        this.maxContentBytes = Math.max(1, retrieval.getMaxContentBytes());
    }

    @Override
    public Optional<String> readContent(String contentPath) {
        if (contentPath == null || contentPath.isBlank()) {
            return Optional.empty();
        }
        Path target;
        try {
            target = contentRoot.resolve(contentPath.trim()).normalize();
        } catch (InvalidPathException e) {
            log.warn("[Content] Invalid content pointer: {}", e.getMessage());
            return Optional.empty();
        }
        if (!target.startsWith(contentRoot)) {
            log.warn("[Content] Content pointer escapes content root: {}", contentPath);
            return Optional.empty();
        }
        if (!Files.isRegularFile(target)) {
            log.debug("[Content] No content at {}", target);
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(target)) {
            byte[] bytes = in.readNBytes((int) Math.min(Integer.MAX_VALUE, maxContentBytes));
            return Optional.of(new String(bytes, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("[Content] Failed to read {}: {}", target, e.getMessage());
            return Optional.empty();
        }
    }
}
