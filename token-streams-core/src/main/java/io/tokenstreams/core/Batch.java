package io.tokenstreams.core;

import java.util.List;
import java.util.Objects;

/**
 * An ordered, non-empty group of outcomes delivered together.
 *
 * @param sequence zero-based position of this batch in its stream
 * @param outcomes the outcomes in decode order
 */
public record Batch<T>(long sequence, List<StreamOutcome<T>> outcomes) {
    public Batch {
        if (sequence < 0) throw new IllegalArgumentException("sequence must not be negative");
        Objects.requireNonNull(outcomes, "outcomes");
        if (outcomes.isEmpty()) throw new IllegalArgumentException("batch must not be empty");
        outcomes = List.copyOf(outcomes);
    }

    public int size() {
        return outcomes.size();
    }

    public StreamOutcome<T> last() {
        return outcomes.get(outcomes.size() - 1);
    }

    /** @return whether this batch carries the stream's terminal outcome */
    public boolean isTerminal() {
        return last().isTerminal();
    }
}
