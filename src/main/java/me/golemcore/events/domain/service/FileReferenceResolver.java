package me.golemcore.events.domain.service;

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

import me.golemcore.events.domain.exception.ManifestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Replaces action parameters that name a file inside the event folder with the
 * contents of that file.
 *
 * <p>
 * A {@code .txt} file becomes an ordered list of its non-blank lines, with
 * {@code #} comment lines dropped (recipient lists). Any other file becomes
 * its trimmed text. Values that do not name an existing regular file inside
 * the folder, including paths that escape it through {@code ..} or symlinks,
 * are returned unchanged.
 */
@Component
@Slf4j
public class FileReferenceResolver {

    private static final String LIST_FILE_SUFFIX = ".txt";
    private static final String COMMENT_PREFIX = "#";

    public Map<String, Object> resolveAll(Map<String, Object> params, Path eventDir) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (params == null) {
            return resolved;
        }
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            resolved.put(entry.getKey(), resolve(entry.getValue(), eventDir));
        }
        return resolved;
    }

    public Object resolve(Object value, Path eventDir) {
        if (!(value instanceof String reference) || reference.isBlank()) {
            return value;
        }

        Path file = locateInFolder(reference, eventDir);
        if (file == null) {
            return value;
        }

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ManifestException("Cannot read referenced file '" + reference + "': " + e.getMessage(), e);
        }
        log.debug("[Loader] Resolved parameter reference {} in {}", reference, eventDir.getFileName());

        if (file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(LIST_FILE_SUFFIX)) {
            return toLines(content);
        }
        return content.strip();
    }

    static List<String> toLines(String content) {
        return content.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .filter(line -> !line.startsWith(COMMENT_PREFIX))
                .toList();
    }

    private Path locateInFolder(String reference, Path eventDir) {
        try {
            Path candidate = eventDir.resolve(reference).normalize();
            if (!Files.isRegularFile(candidate)) {
                return null;
            }
            Path realFolder = eventDir.toRealPath();
            Path realFile = candidate.toRealPath();
            if (!realFile.startsWith(realFolder) || realFile.equals(realFolder)) {
                log.debug("[Loader] Reference {} points outside {}, keeping it verbatim", reference, eventDir);
                return null;
            }
            return realFile;
        } catch (InvalidPathException | IOException e) {
            return null;
        }
    }
}
