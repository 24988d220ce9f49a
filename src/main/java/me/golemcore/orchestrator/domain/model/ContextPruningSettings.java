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

import lombok.Builder;
import lombok.Data;
import lombok.Value;

/**
 * Resolved settings for position-based pruning of old tool results.
 *
 * <p>
 * Instances are immutable. Use {@link #resolve(Overrides)} to merge partial
 * user overrides with {@link #DEFAULTS} field by field; the soft-trim and
 * hard-clear groups are merged independently.
 */
@Value
@Builder(toBuilder = true)
public class ContextPruningSettings {

    public static final String DEFAULT_PLACEHOLDER = "[Old tool result content cleared]";

    public static final ContextPruningSettings DEFAULTS = ContextPruningSettings.builder()
            .enabled(false)
            .keepLastAssistants(3)
            .softTrimRatio(0.3)
            .hardClearRatio(0.5)
            .minPrunableToolChars(50_000)
            .softTrim(new SoftTrim(4_000, 1_500, 1_500))
            .hardClear(new HardClear(true, DEFAULT_PLACEHOLDER))
            .build();

    boolean enabled;
    int keepLastAssistants;
    double softTrimRatio;
    double hardClearRatio;
    int minPrunableToolChars;
    SoftTrim softTrim;
    HardClear hardClear;

    public record SoftTrim(int maxChars, int headChars, int tailChars) {
    }

    public record HardClear(boolean enabled, String placeholder) {
    }

    public static ContextPruningSettings resolve(Overrides overrides) {
        if (overrides == null) {
            return DEFAULTS;
        }
        SoftTrim softDefaults = DEFAULTS.getSoftTrim();
        HardClear hardDefaults = DEFAULTS.getHardClear();
        Overrides.SoftTrimOverrides soft = overrides.getSoftTrim() != null
                ? overrides.getSoftTrim()
                : new Overrides.SoftTrimOverrides();
        Overrides.HardClearOverrides hard = overrides.getHardClear() != null
                ? overrides.getHardClear()
                : new Overrides.HardClearOverrides();

        return ContextPruningSettings.builder()
                .enabled(orDefault(overrides.getEnabled(), DEFAULTS.isEnabled()))
                .keepLastAssistants(orDefault(overrides.getKeepLastAssistants(), DEFAULTS.getKeepLastAssistants()))
                .softTrimRatio(orDefault(overrides.getSoftTrimRatio(), DEFAULTS.getSoftTrimRatio()))
                .hardClearRatio(orDefault(overrides.getHardClearRatio(), DEFAULTS.getHardClearRatio()))
                .minPrunableToolChars(
                        orDefault(overrides.getMinPrunableToolChars(), DEFAULTS.getMinPrunableToolChars()))
                .softTrim(new SoftTrim(
                        orDefault(soft.getMaxChars(), softDefaults.maxChars()),
                        orDefault(soft.getHeadChars(), softDefaults.headChars()),
                        orDefault(soft.getTailChars(), softDefaults.tailChars())))
                .hardClear(new HardClear(
                        orDefault(hard.getEnabled(), hardDefaults.enabled()),
                        orDefault(hard.getPlaceholder(), hardDefaults.placeholder())))
                .build();
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    /**
     * Partial, nullable overrides. Every {@code null} field falls back to the
     * default value. Bound from {@code orchestrator.context-pruning.*}.
     */
    @Data
    public static class Overrides {
        private Boolean enabled;
        private Integer keepLastAssistants;
        private Double softTrimRatio;
        private Double hardClearRatio;
        private Integer minPrunableToolChars;
        private SoftTrimOverrides softTrim = new SoftTrimOverrides();
        private HardClearOverrides hardClear = new HardClearOverrides();

        @Data
        public static class SoftTrimOverrides {
            private Integer maxChars;
            private Integer headChars;
            private Integer tailChars;
        }

        @Data
        public static class HardClearOverrides {
            private Boolean enabled;
            private String placeholder;
        }
    }
}
