package com.dpmfinder.exporter.refresh;

import com.dpmfinder.common.model.CycleReport;

/**
 * Notified after a new {@link CycleReport} has been published. Runs on the refresh
 * thread; implementations must not block for long.
 */
public interface SnapshotListener {

    void onSnapshot(CycleReport report);
}
