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

package me.golemcore.agent.domain.context;

import me.golemcore.agent.domain.model.CompressionCheck;
import me.golemcore.agent.domain.model.ContextThresholds;
import me.golemcore.agent.domain.model.ContextUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.OverflowCheck;

import java.util.List;
import java.util.Locale;

/**
 * Compares estimated context usage with the model limit. Checks use the
 * deterministic estimate; the prompt token count reported by the provider is
 * kept for display only.
 */
public class ContextChecker {

    private final int modelLimit;
    private final ContextThresholds thresholds;
    private int lastPromptTokens;

    public ContextChecker(int modelLimit, ContextThresholds thresholds) {
        if (modelLimit <= 0) {
            throw new IllegalArgumentException("modelLimit must be positive: " + modelLimit);
        }
        this.modelLimit = modelLimit;
        this.thresholds = thresholds != null ? thresholds : ContextThresholds.defaults();
    }

    public OverflowCheck checkOverflow(List<Message> messages) {
        int currentTokens = TokenEstimator.estimateMessages(messages);
        double usagePercent = currentTokens * 100.0 / modelLimit;
        double limitPercent = thresholds.getOverflowWarning() * 100.0;
        if (usagePercent >= limitPercent) {
            String error = String.format(Locale.ROOT,
                    "Context usage %.1f%% exceeds the %.0f%% limit. Compress the conversation or start a new session.",
                    usagePercent, limitPercent);
            return new OverflowCheck(false, currentTokens, usagePercent, error);
        }
        return new OverflowCheck(true, currentTokens, usagePercent, null);
    }

    public CompressionCheck checkCompression(List<Message> messages) {
        int currentTokens = TokenEstimator.estimateMessages(messages);
        int threshold = (int) Math.floor(modelLimit * thresholds.getCompressionTrigger());
        boolean needed = currentTokens >= modelLimit * thresholds.getCompressionTrigger();
        return new CompressionCheck(needed, currentTokens, threshold);
    }

    public ContextUsage getUsage(List<Message> messages) {
        int used = TokenEstimator.estimateMessages(messages);
        double percentage = used * 100.0 / modelLimit;
        String formatted = String.format(Locale.ROOT, "%s / %s (%.1f%%)",
                TokenEstimator.formatTokens(used), TokenEstimator.formatTokens(modelLimit), percentage);
        return new ContextUsage(used, modelLimit, percentage, lastPromptTokens, formatted);
    }

    /**
     * Records the prompt token count the provider actually billed.
     */
    public void updateTokenCount(int promptTokens) {
        this.lastPromptTokens = promptTokens;
    }

    public int getLastPromptTokens() {
        return lastPromptTokens;
    }

    public int getModelLimit() {
        return modelLimit;
    }

    public ContextThresholds getThresholds() {
        return thresholds;
    }
}
