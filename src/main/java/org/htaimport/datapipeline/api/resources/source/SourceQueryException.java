package org.htaimport.datapipeline.api.resources.source;

/**
 * Thrown when a query against the source store fails.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>Lost or refused connection</li>
 *   <li>Malformed or unknown metric identifier</li>
 *   <li>A metric table without any rows</li>
 * </ul>
 * <p>
 * Fatal to the current import run. Nothing is retried internally; the caller
 * re-invokes the whole import.
 */
public class SourceQueryException extends Exception {

    private final String metric;

    /**
     * Creates a SourceQueryException for the given metric.
     *
     * @param metric  the source metric being queried
     * @param message description of the failure
     */
    public SourceQueryException(String metric, String message) {
        super(message);
        this.metric = metric;
    }

    /**
     * Creates a SourceQueryException for the given metric with an underlying cause.
     *
     * @param metric  the source metric being queried
     * @param message description of the failure
     * @param cause   the underlying exception
     */
    public SourceQueryException(String metric, String message, Throwable cause) {
        super(message, cause);
        this.metric = metric;
    }

    public String getMetric() {
        return metric;
    }
}
