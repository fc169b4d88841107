package org.tamodel.arena;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for handle issuing and validation in {@link Arena}.
 */
@Tag("unit")
class ArenaTest {

    /**
     * Handles resolve to the element they were issued for.
     */
    @Test
    void handlesResolveToTheirElements() {
        // Arrange
        Arena<String> arena = new Arena<>("names");

        // Act
        Handle<String> first = arena.add("a");
        Handle<String> second = arena.add("b");

        // Assert
        assertThat(arena.get(first)).isEqualTo("a");
        assertThat(arena.get(second)).isEqualTo("b");
        assertThat(second.index()).isEqualTo(1);
        assertThat(arena.handleOf("b")).isEqualTo(second);
        assertThat(arena.nextHandle().index()).isEqualTo(2);
    }

    /**
     * Handles of another arena and handles past the end are refused.
     */
    @Test
    void refusesForeignAndStaleHandles() {
        // Arrange
        Arena<String> arena = new Arena<>("names");
        Arena<String> other = new Arena<>("others");
        Handle<String> foreign = other.add("x");
        Handle<String> upcoming = arena.nextHandle();

        // Act & Assert
        assertThat(arena.id()).isNotEqualTo(other.id());
        assertThat(arena.owns(foreign)).isFalse();
        assertThatThrownBy(() -> arena.get(foreign)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> arena.get(upcoming)).isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * A copy gets its own id and storage. Handles of the original are refused by the
     * copy until they are translated, and the copy's handles are refused by the original.
     */
    @Test
    void copyHasFreshIdAndOwnStorage() {
        // Arrange
        Arena<StringBuilder> arena = new Arena<>("builders");
        Handle<StringBuilder> handle = arena.add(new StringBuilder("a"));
        List<Handle<StringBuilder>> issued = new ArrayList<>();

        // Act
        Arena<StringBuilder> copy = arena.copy((copied, sb) -> {
            issued.add(copied);
            return new StringBuilder(sb);
        });
        Handle<StringBuilder> translated = copy.translate(handle, arena);
        copy.get(translated).append("b");
        Handle<StringBuilder> added = copy.add(new StringBuilder("c"));

        // Assert
        assertThat(copy.id()).isNotEqualTo(arena.id());
        assertThat(issued).containsExactly(translated);
        assertThat(copy.owns(handle)).isFalse();
        assertThat(arena.owns(translated)).isFalse();
        assertThatThrownBy(() -> copy.get(handle)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> arena.get(added)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> arena.translate(added, copy)).isInstanceOf(IllegalArgumentException.class);
        assertThat(arena.get(handle)).hasToString("a");
        assertThat(copy.get(translated)).hasToString("ab");
        assertThat(arena.size()).isEqualTo(1);
        assertThat(copy.asList()).hasSize(2);
        assertThat(copy.handleAt(1)).contains(added);
        assertThat(copy.handleAt(2)).isEmpty();
    }
}
