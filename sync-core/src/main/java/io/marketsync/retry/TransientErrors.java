package io.marketsync.retry;

import io.marketsync.error.FetchTimeoutException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Separates dropped connections and timeouts (worth retrying) from everything else
 * (bad credentials, bad parameters, schema errors) which must surface immediately.
 * The whole cause chain is inspected since drivers and clients wrap the original failure.
 */
public final class TransientErrors {
    /** MySQL client errors: server has gone away, lost connection during query, lost connection to server. */
    static final Set<Integer> DISCONNECT_CODES = Set.of(2006, 2013, 2055);

    private static final List<String> DISCONNECT_MESSAGES = List.of(
            "lost connection",
            "gone away",
            "connection was killed",
            "connection reset"
    );

    private static final int MAX_DEPTH = 16;

    private TransientErrors() {}

    public static boolean isTransient(Throwable t) {
        Throwable cur = t;
        for (int depth = 0; cur != null && depth < MAX_DEPTH; depth++) {
            if (matches(cur)) return true;
            if (cur.getCause() == cur) break;
            cur = cur.getCause();
        }
        return false;
    }

    private static boolean matches(Throwable t) {
        if (t instanceof FetchTimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof HttpTimeoutException
                || t instanceof SQLTransientConnectionException) {
            return true;
        }
        if (t instanceof SQLException) {
            SQLException se = (SQLException) t;
            if (DISCONNECT_CODES.contains(se.getErrorCode())) return true;
            String state = se.getSQLState();
            if (state != null && state.startsWith("08")) return true;
        }
        String msg = t.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase(Locale.ROOT);
        for (String m : DISCONNECT_MESSAGES) {
            if (lower.contains(m)) return true;
        }
        return false;
    }
}
