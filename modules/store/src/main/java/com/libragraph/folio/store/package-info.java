/**
 * Path-keyed package storage.
 *
 * <p>{@link com.libragraph.folio.store.PackageStore} has two backings with identical
 * behavior: {@link com.libragraph.folio.store.ArchivePackageStore} (in memory) and
 * {@link com.libragraph.folio.store.DirectoryPackageStore} (a directory tree).
 * {@link com.libragraph.folio.store.PackageStores} opens either from the filesystem.
 * Archive reading and writing is done with Commons Compress in the {@code zip} subpackage.
 */
package com.libragraph.folio.store;
