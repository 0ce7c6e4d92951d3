package com.ops.alertdecision.testutil;

import com.ops.alertdecision.exception.StoreException;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.Severity;
import com.ops.alertdecision.model.TimeWindow;
import com.ops.alertdecision.store.HistoricalAlertStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * List-backed history store for workflow tests. Can be switched into a failing mode.
 */
public class InMemoryAlertStore implements HistoricalAlertStore {

    private final List<Alert> alerts = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public void add(Alert alert) {
        alerts.add(alert);
    }

    public List<Alert> all() {
        return new ArrayList<>(alerts);
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public List<Alert> query(String host, String title, Severity severity, TimeWindow window) {
        checkAvailable();
        return alerts.stream()
                .filter(a -> a.getHost().equals(host) && a.getTitle().equals(title))
                .filter(a -> severity == null || a.getSeverity() == severity)
                .filter(a -> window.contains(a.getCreatedAt()))
                .sorted(Comparator.comparing(Alert::getCreatedAt))
                .toList();
    }

    @Override
    public List<Alert> queryByHost(String host, TimeWindow window) {
        checkAvailable();
        return alerts.stream()
                .filter(a -> a.getHost().equals(host))
                .filter(a -> window.contains(a.getCreatedAt()))
                .sorted(Comparator.comparing(Alert::getCreatedAt))
                .toList();
    }

    @Override
    public void append(Alert alert) {
        checkAvailable();
        alerts.add(alert);
    }

    private void checkAvailable() {
        if (failing) {
            throw new StoreException("history store unavailable");
        }
    }
}
