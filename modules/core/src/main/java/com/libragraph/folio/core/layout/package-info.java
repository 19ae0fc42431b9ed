/**
 * Platform adaptation: sentence tracking spans, popup footnotes and generated font faces.
 */
package com.libragraph.folio.core.layout;
