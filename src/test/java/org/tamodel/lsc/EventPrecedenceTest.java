package org.tamodel.lsc;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tamodel.arena.Handle;
import org.tamodel.symbols.Expression;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the ordering policy of co-located simregions.
 */
@Tag("unit")
class EventPrecedenceTest {

    private static final Handle<InstanceLine> LINE = new Handle<>(9, 0);

    /**
     * The default ranks conditions before messages before updates.
     */
    @Test
    void defaultOrder() {
        assertThat(EventPrecedence.DEFAULT.getOrder())
                .containsExactly(EventKind.CONDITION, EventKind.MESSAGE, EventKind.UPDATE);
        assertThat(EventPrecedence.DEFAULT.rank(EventKind.CONDITION)).isZero();
        assertThat(EventPrecedence.DEFAULT.rank(EventKind.UPDATE)).isEqualTo(2);
    }

    /**
     * Configuration names are parsed case-insensitively.
     */
    @Test
    void parsesConfiguredNames() {
        EventPrecedence parsed = EventPrecedence.parse(List.of("update", " Message", "CONDITION"));
        assertThat(parsed).isEqualTo(EventPrecedence.of(EventKind.UPDATE, EventKind.MESSAGE, EventKind.CONDITION));
    }

    /**
     * Incomplete or repeated orderings are rejected.
     */
    @Test
    void rejectsNonPermutations() {
        assertThatThrownBy(() -> EventPrecedence.of(EventKind.MESSAGE, EventKind.UPDATE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EventPrecedence.of(EventKind.MESSAGE, EventKind.MESSAGE, EventKind.UPDATE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EventPrecedence.parse(List.of("MESSAGE", "UPDATE", "ACTION")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * A simregion ranks by its leading present event kind, and the comparator
     * looks at locations first.
     */
    @Test
    void ordersSimregionsByLocationThenRank() {
        // Arrange
        Simregion conditionAndUpdate = new Simregion(0, null,
                new Condition(0, 2, List.of(LINE), Expression.EMPTY, false, false),
                new Update(0, 2, LINE, Expression.EMPTY, false));
        Simregion messageAt2 = Simregion.of(new Message(0, 2, LINE, LINE, Expression.EMPTY, false));
        Simregion updateAt1 = Simregion.of(new Update(1, 1, LINE, Expression.EMPTY, false));
        List<Simregion> simregions = new ArrayList<>(List.of(messageAt2, conditionAndUpdate, updateAt1));

        // Act
        simregions.sort(EventPrecedence.DEFAULT.simregionOrder());

        // Assert
        assertThat(EventPrecedence.DEFAULT.rank(conditionAndUpdate)).isZero();
        assertThat(simregions).containsExactly(updateAt1, conditionAndUpdate, messageAt2);
        assertThat(EventPrecedence.DEFAULT.rank(new Simregion(0, null, null, null))).isEqualTo(3);
    }
}
