/**
 * Parsing, caching and serialization of package documents and content documents.
 */
package com.libragraph.folio.markup;
