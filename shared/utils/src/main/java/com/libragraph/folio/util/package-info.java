/**
 * Shared utilities for all Folio modules.
 *
 * <p>Contains {@link com.libragraph.folio.util.ContentHash} (BLAKE3-128) and
 * {@link com.libragraph.folio.util.PackagePath} entry-path arithmetic.
 * No framework dependencies, only Commons Codec.
 */
package com.libragraph.folio.util;
