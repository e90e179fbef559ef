package org.sunrise.callisto.snr;

import java.util.Objects;

/**
 * A labelled burst occupying time columns {@code startIndex..endIndex}
 * inclusive.
 */
public class BurstLabel {

    private final String label;
    private final int startIndex;
    private final int endIndex;

    public BurstLabel(String label, int startIndex, int endIndex) {
        this.label = Objects.requireNonNull(label);
        this.startIndex = startIndex;
        this.endIndex = endIndex;
    }

    public String getLabel() {
        return label;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getEndIndex() {
        return endIndex;
    }

    @Override
    public String toString() {
        return "BurstLabel{" + "label=" + label + ", startIndex=" + startIndex + ", endIndex=" + endIndex + '}';
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 41 * hash + Objects.hashCode(this.label);
        hash = 41 * hash + this.startIndex;
        hash = 41 * hash + this.endIndex;
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final BurstLabel other = (BurstLabel) obj;
        return this.startIndex == other.startIndex && this.endIndex == other.endIndex && Objects.equals(this.label, other.label);
    }
}
