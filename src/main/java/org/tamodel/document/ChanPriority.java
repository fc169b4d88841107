package org.tamodel.document;

import org.tamodel.symbols.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A channel priority declaration such as {@code chan priority a, b < c < default}.
 * Expressions denote channels or channel arrays; the separator {@code ','} groups
 * channels of equal priority and {@code '<'} increases the priority.
 */
public final class ChanPriority {

    /**
     * One element after the head of the declaration.
     *
     * @param separator The separator preceding the channel, {@code ','} or {@code '<'}.
     * @param channel   The channel expression.
     */
    public record Entry(char separator, Expression channel) {}

    private final Expression head;
    private final List<Entry> tail = new ArrayList<>();

    public ChanPriority(Expression head) {
        this.head = head;
    }

    ChanPriority(ChanPriority other) {
        this(other.head);
        tail.addAll(other.tail);
    }

    public Expression getHead() {
        return head;
    }

    public List<Entry> getTail() {
        return Collections.unmodifiableList(tail);
    }

    void add(char separator, Expression channel) {
        tail.add(new Entry(separator, channel));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(head.text());
        for (Entry entry : tail) {
            if (entry.separator() == ',') {
                sb.append(", ");
            } else {
                sb.append(' ').append(entry.separator()).append(' ');
            }
            sb.append(entry.channel().text());
        }
        return sb.toString();
    }
}
