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

package me.golemcore.agent.tools;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Sandbox root shared by the built-in tools. Every path a tool touches is
 * resolved through {@link #resolve(String)}, which rejects traversal outside
 * the root, including through symlinks.
 */
@Component
@Slf4j
public class Workspace {

    private final Path root;

    public Workspace(AgentProperties properties) {
        this.root = Paths.get(properties.getTools().getWorkspace()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
            log.info("[Tools] Workspace: {}", this.root);
        } catch (IOException e) {
            log.error("[Tools] Failed to create workspace directory: {}", this.root, e);
        }
    }

    public Path getRoot() {
        return root;
    }

    /**
     * @return the resolved path, or empty when it would leave the workspace
     */
    public Optional<Path> resolve(String pathStr) {
        if (pathStr == null || pathStr.isBlank()) {
            return Optional.of(root);
        }
        try {
            Path resolved = root.resolve(pathStr).normalize();
            if (!resolved.startsWith(root)) {
                return Optional.empty();
            }
            if (Files.exists(resolved)) {
                Path realPath = resolved.toRealPath();
                if (!realPath.startsWith(root.toRealPath())) {
                    log.warn("[Tools] Symlink escape blocked: {} -> {}", resolved, realPath);
                    return Optional.empty();
                }
            }
            return Optional.of(resolved);
        } catch (InvalidPathException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("[Tools] Failed to resolve real path: {}", pathStr);
            return Optional.empty();
        }
    }

    public String relativize(Path path) {
        String relative = root.relativize(path).toString().replace('\\', '/');
        return relative.isEmpty() ? "." : relative;
    }
}
