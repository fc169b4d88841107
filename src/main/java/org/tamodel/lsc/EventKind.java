package org.tamodel.lsc;

/**
 * The kinds of scenario events that can share a simregion.
 */
public enum EventKind {
    MESSAGE,
    CONDITION,
    UPDATE
}
