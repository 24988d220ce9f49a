package me.golemcore.orchestrator.domain.system;

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

import me.golemcore.orchestrator.domain.model.OverflowClassification;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;

/**
 * Classifies provider failures that mean "the request did not fit the model's
 * context window".
 *
 * <p>
 * A definite match requires one of the known provider phrases. A likely match
 * also accepts a broader heuristic. Rate-limit, quota and auth errors often
 * mention "limit" too and are never treated as overflow.
 */
public final class LlmErrorClassifier {

    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";

    private static final List<String> CONTEXT_OVERFLOW_PHRASES = List.of(
            "request_too_large",
            "context length exceeded",
            "maximum context length",
            "prompt is too long",
            "exceeds model context window",
            "exceeds the model",
            "too large for model",
            "context_length_exceeded",
            "max_tokens",
            "token limit",
            "input too long",
            "payload too large",
            "content_too_large");

    private static final Pattern CONTEXT_OVERFLOW_HINT = Pattern.compile(
            "413|too large|too long|context.*exceed|exceed.*context|token.*limit|limit.*token"
                    + "|prompt.*size|size.*limit|maximum.*length|length.*maximum",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern FALSE_POSITIVE = Pattern.compile(
            "rate.?limit|too many requests|quota|billing|auth|permission|forbidden",
            Pattern.CASE_INSENSITIVE);

    private LlmErrorClassifier() {
    }

    public static OverflowClassification classifyOverflow(String errorMessage) {
        boolean definite = isContextOverflow(errorMessage);
        return new OverflowClassification(definite, definite || isLikelyContextOverflow(errorMessage));
    }

    /**
     * Classify a failure by walking its cause chain; the first overflow match
     * wins, a definite one is preferred over a likely one.
     */
    public static OverflowClassification classifyOverflow(Throwable throwable) {
        OverflowClassification best = OverflowClassification.NONE;
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);
            OverflowClassification classification = classifyOverflow(current.getMessage());
            if (classification.definite()) {
                return classification;
            }
            if (classification.likely() && !best.likely()) {
                best = classification;
            }
            current = current.getCause();
        }
        return best;
    }

    public static boolean isContextOverflow(String errorMessage) {
        if (errorMessage == null || errorMessage.isEmpty()) {
            return false;
        }
        String normalized = errorMessage.toLowerCase(Locale.ROOT);
        if (FALSE_POSITIVE.matcher(normalized).find()) {
            return false;
        }
        for (String phrase : CONTEXT_OVERFLOW_PHRASES) {
            if (normalized.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isLikelyContextOverflow(String errorMessage) {
        if (errorMessage == null || errorMessage.isEmpty()) {
            return false;
        }
        if (isContextOverflow(errorMessage)) {
            return true;
        }
        String normalized = errorMessage.toLowerCase(Locale.ROOT);
        if (FALSE_POSITIVE.matcher(normalized).find()) {
            return false;
        }
        return CONTEXT_OVERFLOW_HINT.matcher(normalized).find();
    }

    /**
     * Human-readable message of a failure, skipping async wrappers.
     */
    public static String extractErrorMessage(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return "";
        }
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static boolean isCancellation(Throwable error) {
        return unwrap(error) instanceof CancellationException;
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        if (message.startsWith("[" + code + "]")) {
            return message;
        }
        return "[" + code + "] " + message;
    }
}
