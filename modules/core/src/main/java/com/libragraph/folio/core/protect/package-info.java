/**
 * Reversible protection: obfuscated entry paths, scrambled bytes and the protection
 * manifest that records how to undo both.
 */
package com.libragraph.folio.core.protect;
