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

package me.golemcore.negotiation.adapter.outbound.llm;

import me.golemcore.negotiation.domain.exception.CollaboratorException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Maps provider failures onto {@link CollaboratorException.Kind} by walking the
 * cause chain.
 */
public final class CompletionErrorClassifier {

    private static final String LANGCHAIN4J_TIMEOUT_EXCEPTION = "dev.langchain4j.exception.TimeoutException";

    private CompletionErrorClassifier() {
    }

    public static CollaboratorException.Kind classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);
            if (current instanceof CollaboratorException collaborator) {
                return collaborator.getKind();
            }
            if (isTimeout(current)) {
                return CollaboratorException.Kind.TIMEOUT;
            }
            current = current.getCause();
        }
        return CollaboratorException.Kind.UNAVAILABLE;
    }

    public static CollaboratorException toCollaboratorException(Throwable throwable) {
        if (throwable instanceof CollaboratorException collaborator) {
            return collaborator;
        }
        CollaboratorException.Kind kind = classify(throwable);
        String message = throwable.getMessage() != null ? throwable.getMessage()
                : throwable.getClass().getSimpleName();
        return new CollaboratorException(kind, "Completion failed: " + message, throwable);
    }

    private static boolean isTimeout(Throwable throwable) {
        return throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException
                || LANGCHAIN4J_TIMEOUT_EXCEPTION.equals(throwable.getClass().getName());
    }
}
