package me.golemcore.orchestrator.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provider-reported token usage for a single model call, including prompt
 * cache creation/read counts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsage {

    private int inputTokens;
    private int outputTokens;
    private int cacheCreationTokens;
    private int cacheReadTokens;
    private int totalTokens;

    /**
     * Creates a basic usage record with token counts.
     */
    public static TokenUsage of(int inputTokens, int outputTokens) {
        return TokenUsage.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .totalTokens(inputTokens + outputTokens)
                .build();
    }

    /**
     * Folds cache creation and cache read tokens into the input side, which is
     * what the context window actually had to hold.
     */
    public static TokenUsage total(TokenUsage usage) {
        if (usage == null) {
            return TokenUsage.of(0, 0);
        }
        int input = Math.max(0, usage.getInputTokens())
                + Math.max(0, usage.getCacheCreationTokens())
                + Math.max(0, usage.getCacheReadTokens());
        int output = Math.max(0, usage.getOutputTokens());
        return TokenUsage.of(input, output);
    }
}
