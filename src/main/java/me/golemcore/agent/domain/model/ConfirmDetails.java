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

import lombok.Builder;
import lombok.Data;

import java.util.function.Consumer;

/**
 * Describes what the user is asked to confirm. The {@link Type} tag selects
 * which fields are meaningful: {@code fileName} for INFO, {@code filePath} and
 * {@code contentPreview} for EDIT, {@code command} for EXEC, {@code message}
 * for OTHER.
 */
@Data
@Builder
public class ConfirmDetails {

    public enum Type {
        INFO, EDIT, EXEC, OTHER
    }

    private Type type;
    private String title;
    private String fileName;
    private String filePath;
    private String contentPreview;
    private String command;
    private String message;

    /**
     * Key recorded into the allowlist when the user answers ALLOW_ALWAYS.
     */
    private String allowlistKey;

    private Consumer<ConfirmOutcome> onConfirm;

    public static ConfirmDetails info(String title, String fileName) {
        return ConfirmDetails.builder().type(Type.INFO).title(title).fileName(fileName).build();
    }

    public static ConfirmDetails edit(String title, String filePath, String contentPreview) {
        return ConfirmDetails.builder().type(Type.EDIT).title(title).filePath(filePath)
                .contentPreview(contentPreview).allowlistKey(filePath).build();
    }

    public static ConfirmDetails exec(String title, String command, String allowlistKey) {
        return ConfirmDetails.builder().type(Type.EXEC).title(title).command(command)
                .allowlistKey(allowlistKey).build();
    }

    public static ConfirmDetails other(String title, String message) {
        return ConfirmDetails.builder().type(Type.OTHER).title(title).message(message).build();
    }

    /**
     * Short human-readable description for logs and prompts.
     */
    public String describe() {
        if (type == null) {
            return title;
        }
        return switch (type) {
        case INFO -> "Read " + fileName;
        case EDIT -> "Edit " + filePath;
        case EXEC -> "Run: " + command;
        case OTHER -> message != null ? message : title;
        };
    }
}
