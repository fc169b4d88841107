package org.tamodel.template;

import org.tamodel.arena.Handle;

/**
 * The source or destination of an edge: either a location or a branchpoint.
 */
public sealed interface Endpoint permits Endpoint.Location, Endpoint.Branch {

    /**
     * An edge end at a location.
     * @param state The location.
     */
    record Location(Handle<State> state) implements Endpoint {}

    /**
     * An edge end at a branchpoint.
     * @param branchpoint The branchpoint.
     */
    record Branch(Handle<Branchpoint> branchpoint) implements Endpoint {}
}
