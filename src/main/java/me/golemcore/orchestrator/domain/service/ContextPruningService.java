package me.golemcore.orchestrator.domain.service;

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
import me.golemcore.orchestrator.domain.model.ContentBlock;
import me.golemcore.orchestrator.domain.model.ContextPruningSettings;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.port.outbound.TokenCounter;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Position-based degradation of old tool results.
 *
 * <p>
 * A message's age is its distance from the end of the log as a fraction of the
 * log length. Old enough tool results are either soft-trimmed to head + tail or
 * replaced by a placeholder. The system message, everything before the first
 * human message and the last N assistant turns are never touched.
 */
@Service
@Slf4j
public class ContextPruningService {

    public record Result(int softTrimmed, int hardCleared) {

        public static final Result NONE = new Result(0, 0);
    }

    /**
     * Replaces pruned entries of {@code messages} in place and recounts their
     * tokens into {@code indexTokenCountMap}.
     */
    public Result apply(List<Message> messages, Map<Integer, Integer> indexTokenCountMap,
            TokenCounter tokenCounter, ContextPruningSettings settings) {
        if (settings == null || !settings.isEnabled() || messages.isEmpty()) {
            return Result.NONE;
        }

        int total = messages.size();
        Set<Integer> protectedIndices = findProtectedIndices(messages, settings.getKeepLastAssistants());
        int softTrimmed = 0;
        int hardCleared = 0;

        for (int i = 0; i < total; i++) {
            Message message = messages.get(i);
            if (!message.isTool() || protectedIndices.contains(i) || hasImage(message)) {
                continue;
            }
            if (message.hasBlocks() || message.getContent() == null) {
                continue;
            }
            String content = message.getContent();
            if (content.length() < settings.getMinPrunableToolChars()) {
                continue;
            }

            double ageRatio = (double) (total - i) / total;
            Message replacement = null;
            if (ageRatio >= settings.getHardClearRatio() && settings.getHardClear().enabled()) {
                replacement = message.toBuilder().content(settings.getHardClear().placeholder()).build();
                hardCleared++;
            } else if (ageRatio >= settings.getSoftTrimRatio() && content.length() > settings.getSoftTrim().maxChars()) {
                replacement = message.toBuilder().content(softTrim(content, settings.getSoftTrim())).build();
                softTrimmed++;
            }
            if (replacement != null) {
                messages.set(i, replacement);
                indexTokenCountMap.put(i, tokenCounter.count(replacement));
            }
        }

        if (softTrimmed > 0 || hardCleared > 0) {
            log.debug("[Prune] Context pruning: {} soft-trimmed, {} hard-cleared", softTrimmed, hardCleared);
        }
        return new Result(softTrimmed, hardCleared);
    }

    /**
     * System message, messages before the first human message, and the last
     * {@code keepLastAssistants} assistant turns (runs of AI/tool messages)
     * together with the human messages between them.
     */
    Set<Integer> findProtectedIndices(List<Message> messages, int keepLastAssistants) {
        Set<Integer> protectedIndices = new HashSet<>();
        int total = messages.size();
        if (messages.get(0).isSystem()) {
            protectedIndices.add(0);
        }
        for (int i = 0; i < total; i++) {
            if (messages.get(i).isHuman()) {
                break;
            }
            protectedIndices.add(i);
        }

        int turnsFound = 0;
        boolean inAssistantRun = false;
        for (int i = total - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.isAi() || message.isTool()) {
                protectedIndices.add(i);
                inAssistantRun = true;
                continue;
            }
            if (inAssistantRun) {
                turnsFound++;
                inAssistantRun = false;
                if (turnsFound >= keepLastAssistants) {
                    break;
                }
            }
            if (turnsFound < keepLastAssistants) {
                protectedIndices.add(i);
            }
        }
        return protectedIndices;
    }

    static String softTrim(String content, ContextPruningSettings.SoftTrim settings) {
        int head = Math.min(settings.headChars(), content.length());
        int tail = Math.min(settings.tailChars(), content.length());
        String indicator = "\n\n… [soft-trimmed: " + content.length() + " chars → "
                + (settings.headChars() + settings.tailChars()) + " chars, middle removed] …\n\n";
        return content.substring(0, head) + indicator + content.substring(content.length() - tail);
    }

    private static boolean hasImage(Message message) {
        if (!message.hasBlocks()) {
            return false;
        }
        for (ContentBlock block : message.getBlocks()) {
            if (block.isImage()) {
                return true;
            }
        }
        return false;
    }
}
