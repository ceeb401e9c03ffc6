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

package me.golemcore.agent.domain.model;

import java.util.Locale;

/**
 * Governs when the tool scheduler asks the user before running a tool.
 */
public enum ApprovalMode {

    /**
     * Confirm every tool that is not read-only.
     */
    DEFAULT,

    /**
     * Auto-approve file edits, still confirm other side effects.
     */
    AUTO_EDIT,

    /**
     * Auto-approve everything.
     */
    YOLO;

    /**
     * Parses configuration values such as {@code default}, {@code autoEdit},
     * {@code auto-edit}, {@code yolo} or {@code fullAuto}.
     */
    public static ApprovalMode parse(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String normalized = value.trim().replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
        return switch (normalized) {
        case "default" -> DEFAULT;
        case "autoedit" -> AUTO_EDIT;
        case "yolo", "fullauto" -> YOLO;
        default -> throw new IllegalArgumentException("Unknown approval mode: " + value);
        };
    }
}
