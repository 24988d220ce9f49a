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

import java.util.Locale;

/**
 * Variant tag of a conversation {@link Message}. Every branch over message kind
 * in the reducer, cache injector and pruner switches on this enum.
 */
public enum MessageType {

    HUMAN("human"),

    AI("ai"),

    SYSTEM("system"),

    TOOL("tool"),

    /**
     * Transient removal marker consumed by the reducer, never persisted.
     */
    REMOVE("remove");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves both langchain-style types ({@code human}, {@code ai}) and chat
     * roles ({@code user}, {@code assistant}).
     *
     * @throws IllegalArgumentException
     *             for unknown roles
     */
    public static MessageType fromRole(String role) {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("Message role is required");
        }
        String normalized = role.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
        case "human", "user" -> HUMAN;
        case "ai", "assistant" -> AI;
        case "system", "developer" -> SYSTEM;
        case "tool", "function" -> TOOL;
        case "remove" -> REMOVE;
        default -> throw new IllegalArgumentException("Unknown message role: " + role);
        };
    }
}
