/**
 * Pure Java value types shared across all Folio modules.
 *
 * <p>Entry content flags, the failure taxonomy and the EPUB constants every
 * module agrees on. This module has no dependencies.
 */
package com.libragraph.folio.types;
