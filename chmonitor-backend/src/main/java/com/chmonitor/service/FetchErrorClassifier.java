package com.chmonitor.service;

import com.chmonitor.model.FetchError;
import com.chmonitor.model.FetchErrorType;
import com.chmonitor.query.SystemTables;
import com.chmonitor.query.TableValidator;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLInvalidAuthorizationSpecException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps failures raised while dispatching a query to a {@link FetchErrorType}.
 *
 * <p>Exception types are checked first, then ClickHouse server error codes, then message text.
 */
public final class FetchErrorClassifier {
    private static final Set<Integer> TABLE_CODES = Set.of(60, 81);
    private static final Set<Integer> PERMISSION_CODES = Set.of(164, 497, 516);
    private static final Set<Integer> NETWORK_CODES = Set.of(159, 209, 210);
    // UNKNOWN_IDENTIFIER, reported as "Missing columns: ..."
    private static final Set<Integer> QUERY_CODES = Set.of(47);

    private static final Pattern TABLE_MISSING = Pattern.compile(
            "unknown table|unknown_table|table.*(not found|doesn't exist|does not exist|missing)"
                    + "|missing tables?\\b");
    private static final Pattern PERMISSION = Pattern.compile(
            "permission|access denied|authentication|unauthorized|forbidden|not enough privileges");
    private static final Pattern NETWORK = Pattern.compile(
            "network|connection|timeout|timed out|econnrefused|enotfound|etimedout");
    private static final Pattern VALIDATION = Pattern.compile(
            "invalid|missing required|required parameter|must be|validation");
    private static final Pattern TABLE_NAME = Pattern.compile(
            "table\\s+[`'\"]?([\\w]+)[`'\"]?\\.[`'\"]?([\\w]+)[`'\"]?", Pattern.CASE_INSENSITIVE);

    private FetchErrorClassifier() {
    }

    /**
     * Classifies a failure and builds the error payload.
     *
     * @param error failure, possibly wrapped by {@link CompletionException}
     * @param host address of the target host, may be {@code null}
     * @param sql statement that failed, used to infer missing tables; may be {@code null}
     * @return error payload
     */
    public static FetchError classify(Throwable error, String host, String sql) {
        Throwable cause = unwrap(error);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        FetchErrorType type = classifyType(cause);

        FetchError.Details.DetailsBuilder details = FetchError.Details.builder()
                .host(host)
                .originalError(message);
        if (type == FetchErrorType.TABLE_NOT_FOUND) {
            List<String> missing = missingTables(message, sql);
            details.missingTables(missing)
                    .docs(SystemTables.guidanceFor(missing).map(SystemTables.TableGuidance::getDocsUrl).orElse(null));
        }
        return FetchError.builder()
                .type(type)
                .message(message)
                .details(details.build())
                .build();
    }

    public static FetchErrorType classifyType(Throwable error) {
        Throwable cause = unwrap(error);

        for (Throwable t = cause; t != null; t = t.getCause() == t ? null : t.getCause()) {
            FetchErrorType byType = byType(t);
            if (byType != null) {
                return byType;
            }
            if (t instanceof SQLException sql) {
                FetchErrorType byCode = byCode(sql.getErrorCode());
                if (byCode != null) {
                    return byCode;
                }
            }
        }
        return byMessage(cause.getMessage());
    }

    static FetchErrorType byMessage(String message) {
        if (message == null) {
            return FetchErrorType.QUERY_ERROR;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (TABLE_MISSING.matcher(lower).find()) {
            return FetchErrorType.TABLE_NOT_FOUND;
        }
        if (PERMISSION.matcher(lower).find()) {
            return FetchErrorType.PERMISSION_ERROR;
        }
        if (NETWORK.matcher(lower).find()) {
            return FetchErrorType.NETWORK_ERROR;
        }
        if (VALIDATION.matcher(lower).find()) {
            return FetchErrorType.VALIDATION_ERROR;
        }
        return FetchErrorType.QUERY_ERROR;
    }

    /**
     * Extracts qualified table names from a server message, falling back to the tables referenced
     * by the statement.
     */
    static List<String> missingTables(String message, String sql) {
        if (message != null) {
            Matcher m = TABLE_NAME.matcher(message);
            if (m.find()) {
                return List.of(m.group(1) + "." + m.group(2));
            }
        }
        if (sql != null) {
            return TableValidator.parseTables(sql);
        }
        return List.of();
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static FetchErrorType byType(Throwable t) {
        if (t instanceof HostNotFoundException
                || t instanceof QueryValidationException
                || t instanceof IllegalArgumentException) {
            return FetchErrorType.VALIDATION_ERROR;
        }
        if (t instanceof SQLInvalidAuthorizationSpecException) {
            return FetchErrorType.PERMISSION_ERROR;
        }
        if (t instanceof SQLTransientConnectionException
                || t instanceof SQLNonTransientConnectionException
                || t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof SocketTimeoutException
                || t instanceof TimeoutException) {
            return FetchErrorType.NETWORK_ERROR;
        }
        return null;
    }

    private static FetchErrorType byCode(int code) {
        if (TABLE_CODES.contains(code)) {
            return FetchErrorType.TABLE_NOT_FOUND;
        }
        if (PERMISSION_CODES.contains(code)) {
            return FetchErrorType.PERMISSION_ERROR;
        }
        if (NETWORK_CODES.contains(code)) {
            return FetchErrorType.NETWORK_ERROR;
        }
        if (QUERY_CODES.contains(code)) {
            return FetchErrorType.QUERY_ERROR;
        }
        return null;
    }
}
