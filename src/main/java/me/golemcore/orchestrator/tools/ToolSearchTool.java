package me.golemcore.orchestrator.tools;

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
import me.golemcore.orchestrator.domain.component.AgentTool;
import me.golemcore.orchestrator.domain.model.AgentContext;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolInvocation;
import me.golemcore.orchestrator.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regex search over the agent's deferred tool registry.
 *
 * <p>
 * Name matches score 0.95, description matches 0.75 and parameter-name matches
 * 0.60; only the best field of each tool is reported. Patterns prone to
 * catastrophic backtracking are searched as literals. Every matched tool is
 * marked as discovered on the agent context, so it is bound to the model from
 * the next call on.
 *
 * <p>
 * Parameters:
 * <ul>
 * <li>{@code query} - regex, at most 200 characters</li>
 * <li>{@code fields} - subset of {@code name}, {@code description},
 * {@code parameters}; default name and description</li>
 * <li>{@code max_results} - 1..50, default 10</li>
 * </ul>
 */
@Component
@Slf4j
public class ToolSearchTool implements AgentTool {

    public static final String NAME = "tool_search";

    static final int MAX_PATTERN_LENGTH = 200;
    static final int MAX_GROUP_DEPTH = 5;
    static final int DEFAULT_MAX_RESULTS = 10;
    static final int MAX_RESULTS_LIMIT = 50;
    static final int SNIPPET_LENGTH = 100;

    static final double NAME_SCORE = 0.95;
    static final double DESCRIPTION_SCORE = 0.75;
    static final double PARAMETERS_SCORE = 0.60;

    private static final String FIELD_NAME = "name";
    private static final String FIELD_DESCRIPTION = "description";
    private static final String FIELD_PARAMETERS = "parameters";
    private static final List<String> DEFAULT_FIELDS = List.of(FIELD_NAME, FIELD_DESCRIPTION);

    private static final Pattern NESTED_QUANTIFIER = Pattern.compile("\\([^)]*[+*][^)]*\\)[+*?]");
    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile("\\.\\{1000,\\}"),
            Pattern.compile("\\(\\?=\\.\\{100,\\}\\)"),
            Pattern.compile("\\([^)]*\\|\\s*\\)\\{20,\\}"),
            Pattern.compile("\\(\\.\\*\\)\\+"),
            Pattern.compile("\\(\\.\\+\\)\\+"),
            Pattern.compile("\\(\\.\\*\\)\\*"),
            Pattern.compile("\\(\\.\\+\\)\\*"));

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Searches through available tools to find ones matching your query pattern.
                        Provide a regex pattern to search tool names and descriptions. Results include \
                        tool names, match quality scores, and snippets showing where the match occurred. \
                        Higher scores (0.9+) indicate name matches, medium scores (0.7+) indicate \
                        description matches.""")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "query", Map.of(
                                        "type", "string",
                                        "description", "Regex pattern to search tool names and descriptions"),
                                "fields", Map.of(
                                        "type", "array",
                                        "items", Map.of("type", "string",
                                                "enum", List.of(FIELD_NAME, FIELD_DESCRIPTION, FIELD_PARAMETERS)),
                                        "description", "Which fields to search. Default: name and description"),
                                "max_results", Map.of(
                                        "type", "integer",
                                        "minimum", 1,
                                        "maximum", MAX_RESULTS_LIMIT,
                                        "description", "Maximum number of matching tools to return")),
                        "required", List.of("query")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
        Map<String, Object> args = invocation.getArguments() != null ? invocation.getArguments() : Map.of();
        Object rawQuery = args.get("query");
        if (!(rawQuery instanceof String query) || query.isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.failure("query is required"));
        }
        if (query.length() > MAX_PATTERN_LENGTH) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("query must be at most " + MAX_PATTERN_LENGTH + " characters"));
        }
        AgentContext context = invocation.getAgentContext();
        if (context == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("No tool registry available"));
        }
        return CompletableFuture.completedFuture(search(context, query, resolveFields(args.get("fields")),
                resolveMaxResults(args.get("max_results"))));
    }

    ToolResult search(AgentContext context, String query, List<String> fields, int maxResults) {
        SanitizedPattern sanitized = sanitize(query);
        String warning = sanitized.escaped()
                ? "Note: The provided pattern was converted to a literal search for safety.\n\n"
                : "";

        Map<String, ToolDefinition> registry = context.getDeferredToolRegistry(true);
        if (registry.isEmpty()) {
            return ToolResult.success(warning + "No tools available to search. The tool registry is empty "
                    + "or no deferred tools are registered.", artifact(List.of(), 0, sanitized.pattern()));
        }

        Pattern regex = Pattern.compile(sanitized.pattern(), Pattern.CASE_INSENSITIVE);
        List<ToolMatch> matches = new ArrayList<>();
        for (ToolDefinition definition : registry.values()) {
            ToolMatch match = matchTool(definition, regex, fields);
            if (match != null) {
                matches.add(match);
            }
        }
        // stable sort keeps registry order among equal scores
        matches.sort(Comparator.comparingDouble(ToolMatch::score).reversed());
        List<ToolMatch> top = matches.subList(0, Math.min(maxResults, matches.size()));

        if (!top.isEmpty()) {
            context.markToolsAsDiscovered(top.stream().map(ToolMatch::toolName).toList());
            log.info("[Tools] Tool search '{}' discovered {}", sanitized.pattern(),
                    top.stream().map(ToolMatch::toolName).toList());
        }
        String output = warning + format(top, registry.size(), sanitized.pattern());
        return ToolResult.success(output, artifact(top, registry.size(), sanitized.pattern()));
    }

    private static ToolMatch matchTool(ToolDefinition definition, Pattern regex, List<String> fields) {
        String name = definition.getName();
        if (fields.contains(FIELD_NAME) && name != null && regex.matcher(name).find()) {
            return new ToolMatch(name, NAME_SCORE, FIELD_NAME, name);
        }
        String description = definition.getDescription();
        if (fields.contains(FIELD_DESCRIPTION) && description != null && regex.matcher(description).find()) {
            return new ToolMatch(name, DESCRIPTION_SCORE, FIELD_DESCRIPTION,
                    description.substring(0, Math.min(SNIPPET_LENGTH, description.length())));
        }
        if (fields.contains(FIELD_PARAMETERS)) {
            String parameterNames = parameterNames(definition.getInputSchema());
            if (!parameterNames.isEmpty() && regex.matcher(parameterNames).find()) {
                return new ToolMatch(name, PARAMETERS_SCORE, FIELD_PARAMETERS, parameterNames);
            }
        }
        return null;
    }

    private static String parameterNames(Map<String, Object> schema) {
        if (schema == null || !(schema.get("properties") instanceof Map<?, ?> properties)) {
            return "";
        }
        List<String> names = new ArrayList<>();
        for (Object key : properties.keySet()) {
            names.add(String.valueOf(key));
        }
        return String.join(" ", names);
    }

    static String format(List<ToolMatch> matches, int totalSearched, String pattern) {
        if (matches.isEmpty()) {
            return "No tools matched the pattern \"" + pattern + "\".\nTotal tools searched: " + totalSearched;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(matches.size()).append(" matching tools:\n\n");
        for (ToolMatch match : matches) {
            sb.append("- ").append(match.toolName())
                    .append(" (score: ").append(String.format(Locale.ROOT, "%.2f", match.score())).append(")\n");
            sb.append("  Matched in: ").append(match.matchedField()).append('\n');
            sb.append("  Snippet: ").append(match.snippet()).append("\n\n");
        }
        sb.append("Total tools searched: ").append(totalSearched).append('\n');
        sb.append("Pattern used: ").append(pattern);
        return sb.toString();
    }

    private static Map<String, Object> artifact(List<ToolMatch> matches, int totalSearched, String pattern) {
        List<Map<String, Object>> references = new ArrayList<>();
        for (ToolMatch match : matches) {
            Map<String, Object> reference = new LinkedHashMap<>();
            reference.put("tool_name", match.toolName());
            reference.put("match_score", match.score());
            reference.put("matched_field", match.matchedField());
            reference.put("snippet", match.snippet());
            references.add(reference);
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("total_searched", totalSearched);
        metadata.put("pattern", pattern);

        Map<String, Object> artifact = new LinkedHashMap<>();
        artifact.put("tool_references", references);
        artifact.put("metadata", metadata);
        return artifact;
    }

    /**
     * Dangerous or invalid patterns become a literal search.
     */
    static SanitizedPattern sanitize(String pattern) {
        if (isDangerous(pattern)) {
            return new SanitizedPattern(Pattern.quote(pattern), true);
        }
        try {
            Pattern.compile(pattern);
            return new SanitizedPattern(pattern, false);
        } catch (PatternSyntaxException e) {
            return new SanitizedPattern(Pattern.quote(pattern), true);
        }
    }

    static boolean isDangerous(String pattern) {
        if (NESTED_QUANTIFIER.matcher(pattern).find()) {
            return true;
        }
        if (groupDepth(pattern) > MAX_GROUP_DEPTH) {
            return true;
        }
        for (Pattern dangerous : DANGEROUS_PATTERNS) {
            if (dangerous.matcher(pattern).find()) {
                return true;
            }
        }
        return false;
    }

    private static int groupDepth(String pattern) {
        int max = 0;
        int depth = 0;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            boolean escaped = i > 0 && pattern.charAt(i - 1) == '\\';
            if (c == '(' && !escaped) {
                depth++;
                max = Math.max(max, depth);
            } else if (c == ')' && !escaped) {
                depth = Math.max(0, depth - 1);
            }
        }
        return max;
    }

    private static List<String> resolveFields(Object raw) {
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            return DEFAULT_FIELDS;
        }
        List<String> fields = new ArrayList<>();
        for (Object item : list) {
            String field = String.valueOf(item).toLowerCase(Locale.ROOT);
            if (FIELD_NAME.equals(field) || FIELD_DESCRIPTION.equals(field) || FIELD_PARAMETERS.equals(field)) {
                fields.add(field);
            }
        }
        return fields.isEmpty() ? DEFAULT_FIELDS : fields;
    }

    private static int resolveMaxResults(Object raw) {
        if (raw instanceof Number number) {
            return Math.max(1, Math.min(MAX_RESULTS_LIMIT, number.intValue()));
        }
        return DEFAULT_MAX_RESULTS;
    }

    record SanitizedPattern(String pattern, boolean escaped) {
    }

    record ToolMatch(String toolName, double score, String matchedField, String snippet) {
    }
}
