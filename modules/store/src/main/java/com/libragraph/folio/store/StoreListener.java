package com.libragraph.folio.store;

/**
 * Observer of entry mutations. Used by document caches to drop parsed forms of
 * entries that were overwritten or deleted.
 */
@FunctionalInterface
public interface StoreListener {

    enum Change { WRITTEN, DELETED }

    void entryChanged(String path, Change change);
}
