package com.vidnyan.playscan.domain.model;

import java.util.Comparator;

/**
 * Source code location of a script element.
 * Lines and columns are 1-based, 0 when unknown.
 */
public record Location(
    String filePath,
    int line,
    int column
) implements Comparable<Location> {

    private static final Comparator<Location> ORDER = Comparator
            .comparing(Location::filePath, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(Location::line)
            .thenComparingInt(Location::column);

    /**
     * Create a location.
     */
    public static Location at(String filePath, int line, int column) {
        return new Location(filePath, line, column);
    }

    /**
     * Location for synthetic elements that have no source position.
     */
    public static Location unknown() {
        return new Location("unknown file", 0, 0);
    }

    public boolean isKnown() {
        return line > 0;
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line + ":" + column;
    }

    @Override
    public int compareTo(Location other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return format();
    }
}
