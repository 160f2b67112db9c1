package net.papermentat.exception;

/**
 * Non-2xx answer from a provider or artifact host.
 */
public class UpstreamStatusException extends RuntimeException {

    private final int status;

    public UpstreamStatusException(String url, int status) {
        super("HTTP " + status + " from " + url);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    /**
     * @return {@code true} for server errors and rate-limit rejections
     */
    public boolean isTransient() {
        return status >= 500 || status == 429;
    }
}
