package com.example.media_analyzer.engine;

import com.example.media_analyzer.exception.TransportFailureException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.netty.http.client.PrematureCloseException;

import java.util.concurrent.TimeoutException;

/**
 * Classifies and wraps failures of provider calls.
 */
final class EngineFailures {
    private EngineFailures() {}

    /** Connection-level failures worth one more attempt inside the same call. */
    static boolean isTransient(Throwable throwable) {
        return hasCause(throwable, PrematureCloseException.class) || hasCause(throwable, WebClientRequestException.class);
    }

    static TransportFailureException transport(String call, Throwable failure) {
        Throwable cause = Exceptions.unwrap(failure);
        if (cause instanceof TransportFailureException tfe) {
            return tfe;
        }
        if (hasCause(cause, TimeoutException.class) || isBlockTimeout(cause)) {
            return new TransportFailureException(call + " timed out", cause);
        }
        Throwable root = rootCause(cause);
        return new TransportFailureException(call + " failed: " + root.getClass().getSimpleName()
                + (root.getMessage() == null ? "" : " " + root.getMessage()), cause);
    }

    static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    private static boolean isBlockTimeout(Throwable t) {
        return t instanceof IllegalStateException && t.getMessage() != null && t.getMessage().startsWith("Timeout on blocking read");
    }

    private static boolean hasCause(Throwable throwable, Class<? extends Throwable> type) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (type.isInstance(cursor)) return true;
            if (cursor.getCause() == cursor) break;
            cursor = cursor.getCause();
        }
        return false;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        return cursor;
    }
}
