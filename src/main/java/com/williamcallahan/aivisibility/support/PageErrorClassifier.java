package com.williamcallahan.aivisibility.support;

import com.williamcallahan.aivisibility.domain.analysis.PageErrorType;
import com.williamcallahan.aivisibility.service.PageAnalysisException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies page analysis failures into {@link PageErrorType} and picks the message shown to users.
 *
 * <p>The whole cause chain is inspected. Typed signals (timeouts, socket failures, HTTP status
 * codes) win over message matching; message matching follows the order timeout, network,
 * access denied, not found, quota.</p>
 */
public final class PageErrorClassifier {

    private static final String FALLBACK_MESSAGE = PageErrorType.OTHER.userMessage();

    private PageErrorClassifier() {}

    /**
     * Determines the failure category of an analysis error.
     *
     * @param error failure raised while analyzing a page
     * @return failure category, {@link PageErrorType#OTHER} when nothing matches
     */
    public static PageErrorType classify(Throwable error) {
        if (error == null) {
            return PageErrorType.OTHER;
        }

        Throwable current = error;
        while (current != null) {
            if (current instanceof PageAnalysisException analysisException) {
                if (analysisException.errorType() != null) {
                    return analysisException.errorType();
                }
                PageErrorType byStatus = fromHttpStatus(analysisException.httpStatus());
                if (byStatus != null) {
                    return byStatus;
                }
            }
            if (current instanceof TimeoutException || current instanceof SocketTimeoutException) {
                return PageErrorType.TIMEOUT;
            }
            if (current instanceof ConnectException
                    || current instanceof UnknownHostException
                    || current instanceof NoRouteToHostException) {
                return PageErrorType.NETWORK;
            }
            current = current.getCause();
        }

        String message = collectMessages(error).toLowerCase(Locale.ROOT);
        if (message.contains("timeout") || message.contains("timed out") || message.contains("aborted")) {
            return PageErrorType.TIMEOUT;
        } else if (message.contains("network")
                || message.contains("fetch")
                || message.contains("connection")
                || message.contains("econnrefused")
                || message.contains("enotfound")) {
            return PageErrorType.NETWORK;
        } else if (message.contains("403") || message.contains("forbidden")) {
            return PageErrorType.ACCESS_DENIED;
        } else if (message.contains("404") || message.contains("not found")) {
            return PageErrorType.NOT_FOUND;
        } else if (message.contains("quota")
                || message.contains("rate limit")
                || message.contains("429")
                || message.contains("too many requests")) {
            return PageErrorType.QUOTA;
        }
        return PageErrorType.OTHER;
    }

    /**
     * Chooses the user-facing message for a classified failure.
     *
     * <p>Known categories use their fixed message. Unclassified failures surface the original
     * message so unexpected problems stay diagnosable.</p>
     *
     * @param errorType classification from {@link #classify(Throwable)}
     * @param error the failure
     * @return message suitable for a page result
     */
    public static String userMessage(PageErrorType errorType, Throwable error) {
        if (errorType != PageErrorType.OTHER) {
            return errorType.userMessage();
        }
        Throwable root = unwrap(error);
        if (root == null || root.getMessage() == null || root.getMessage().isBlank()) {
            return FALLBACK_MESSAGE;
        }
        return root.getMessage().trim();
    }

    /**
     * Strips executor wrappers so the failure raised by the analyzer is reported.
     *
     * @param error possibly wrapped failure
     * @return the innermost non-wrapper throwable
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static PageErrorType fromHttpStatus(OptionalInt httpStatus) {
        if (httpStatus.isEmpty()) {
            return null;
        }
        int status = httpStatus.getAsInt();
        if (status == 401 || status == 403) {
            return PageErrorType.ACCESS_DENIED;
        } else if (status == 404 || status == 410) {
            return PageErrorType.NOT_FOUND;
        } else if (status == 429) {
            return PageErrorType.QUOTA;
        } else if (status == 408 || status == 504) {
            return PageErrorType.TIMEOUT;
        }
        return null;
    }

    private static String collectMessages(Throwable error) {
        StringBuilder messageBuilder = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            String currentMessage = current.getMessage();
            if (currentMessage != null && !currentMessage.isBlank()) {
                if (messageBuilder.length() > 0) {
                    messageBuilder.append(' ');
                }
                messageBuilder.append(currentMessage);
            }
            current = current.getCause();
        }
        return messageBuilder.toString();
    }
}
