package org.tamodel.document;

import org.tamodel.symbols.Expression;

/**
 * A progress measure: {@code measure} must increase whenever {@code guard} holds.
 *
 * @param guard   The guard, may be {@link Expression#EMPTY}.
 * @param measure The measure.
 */
public record ProgressMeasure(Expression guard, Expression measure) {}
