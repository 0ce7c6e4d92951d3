package com.ops.alertdecision.store;

import com.ops.alertdecision.exception.StoreException;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.Severity;
import com.ops.alertdecision.model.TimeWindow;

import java.util.List;

/**
 * Append-only history of every alert the engine has decided on.
 * Callers treat it as external: any method may fail with {@link StoreException}.
 */
public interface HistoricalAlertStore {

    /**
     * Alerts with the given host and title created inside {@code window}, oldest first.
     *
     * @param severity restricts the match to one severity; {@code null} matches any
     */
    List<Alert> query(String host, String title, Severity severity, TimeWindow window);

    /**
     * Alerts of any title on {@code host} created inside {@code window}, oldest first.
     */
    List<Alert> queryByHost(String host, TimeWindow window);

    void append(Alert alert);
}
