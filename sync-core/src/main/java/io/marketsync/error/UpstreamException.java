package io.marketsync.error;

/**
 * The upstream provider answered but rejected the request (bad token, bad parameters,
 * quota exhausted). Never retried.
 */
public class UpstreamException extends SyncException {
    private final int code;

    public UpstreamException(String api, int code, String message) {
        super(api + " rejected with code " + code + ": " + message);
        this.code = code;
    }

    public int code() { return code; }
}
