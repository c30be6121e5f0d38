/**
 * Pure Java value types shared across all catalog modules.
 *
 * <p>Holds the dialect and canonical-field vocabularies. The notation
 * normalizer lives in {@code shared/utils}.
 * This module has no framework dependencies.
 */
package com.libragraph.catalog.types;
