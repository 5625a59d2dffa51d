package com.krishnamouli.cohort.store;

/**
 * Notified after a snapshot has been swapped in.
 */
@FunctionalInterface
public interface SnapshotListener {

    void onPublish(ConfigSnapshot previous, ConfigSnapshot current);
}
