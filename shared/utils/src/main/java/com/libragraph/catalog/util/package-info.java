/**
 * Shared utilities for all catalog modules.
 *
 * <p>Contains {@link com.libragraph.catalog.util.TrackDiscNotation}, the parser for
 * "N", "N/M" and pair-shaped track/disc numbers.
 * No framework dependencies.
 */
package com.libragraph.catalog.util;
