package me.golemcore.orchestrator.infrastructure.config;

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

import lombok.Data;
import me.golemcore.orchestrator.domain.model.ContextPruningSettings;
import me.golemcore.orchestrator.domain.system.toolloop.ToolRoutingEngine;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Orchestrator settings bound from application.properties under the
 * {@code orchestrator.*} prefix.
 *
 * <p>
 * Context pruning values are nullable overrides; unset fields fall back to
 * {@link ContextPruningSettings#DEFAULTS} when resolved.
 */
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private ContextPruningSettings.Overrides contextPruning = new ContextPruningSettings.Overrides();
    private ToolsProperties tools = new ToolsProperties();
    private OverflowProperties overflow = new OverflowProperties();
    private CacheProperties cache = new CacheProperties();

    public ContextPruningSettings resolveContextPruning() {
        return ContextPruningSettings.resolve(contextPruning);
    }

    @Data
    public static class ToolsProperties {
        private boolean handleErrors = true;
        private Duration timeout = Duration.ofSeconds(60);
        private String serverToolIdPrefix = ToolRoutingEngine.DEFAULT_SERVER_TOOL_ID_PREFIX;
        private int parallelism = 8;
    }

    @Data
    public static class OverflowProperties {
        private int maxRecoveryAttempts = 1;
        private int minTruncationChars = 1000;
    }

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
    }
}
