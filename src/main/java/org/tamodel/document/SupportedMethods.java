package org.tamodel.document;

/**
 * The analysis methods a document can be handed to.
 *
 * @param symbolic   Symbolic (zone based) model checking.
 * @param stochastic Statistical model checking.
 * @param concrete   Concrete simulation.
 */
public record SupportedMethods(boolean symbolic, boolean stochastic, boolean concrete) {

    public static final SupportedMethods ALL = new SupportedMethods(true, true, true);
}
