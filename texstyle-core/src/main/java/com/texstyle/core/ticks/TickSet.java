package com.texstyle.core.ticks;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Tick positions paired with their typeset labels. Both lists have the same length.
 *
 * @since 1.0.0
 */
public final class TickSet {

    private final List<Double> positions;
    private final List<String> labels;

    TickSet(List<Double> positions, List<String> labels) {
        if (positions.size() != labels.size()) {
            throw new IllegalArgumentException(
                    "positions and labels differ in size: " + positions.size() + " vs " + labels.size());
        }
        this.positions = Collections.unmodifiableList(positions);
        this.labels = Collections.unmodifiableList(labels);
    }

    public List<Double> getPositions() {
        return positions;
    }

    public List<String> getLabels() {
        return labels;
    }

    public int size() {
        return positions.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TickSet that))
            return false;
        return positions.equals(that.positions) && labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positions, labels);
    }

    @Override
    public String toString() {
        return "TickSet{positions=" + positions + ", labels=" + labels + '}';
    }
}
