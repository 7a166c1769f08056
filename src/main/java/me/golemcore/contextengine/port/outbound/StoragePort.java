package me.golemcore.contextengine.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Document storage underneath the context store. Documents are addressed by
 * a directory and a relative path.
 */
public interface StoragePort {

    /**
     * Read a document, completing with {@code null} when it does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Replace a document so that readers see either the old or the new content,
     * never a partial write.
     *
     * @param backup
     *            if true, the previous version is kept next to the document with
     *            a {@code .bak} suffix
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    CompletableFuture<Void> ensureDirectory(String directory);
}
