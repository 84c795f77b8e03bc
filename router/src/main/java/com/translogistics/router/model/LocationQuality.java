package com.translogistics.router.model;

/**
 * Confidence tier of a stop's coordinates.
 */
public enum LocationQuality {
    PRECISE,
    APPROXIMATE,
    LANDMARK
}
