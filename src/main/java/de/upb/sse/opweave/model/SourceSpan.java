package de.upb.sse.opweave.model;

/**
 * Half-open range {@code [start, end)} of offsets into one file buffer.
 * Offsets index the buffer's {@code char} sequence.
 */
public final class SourceSpan implements Comparable<SourceSpan> {
    private final int start;
    private final int end;

    public SourceSpan(int start, int end) {
        if (start < 0) {
            throw new IllegalArgumentException("span start must not be negative: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("span end " + end + " lies before start " + start);
        }
        this.start = start;
        this.end = end;
    }

    public static SourceSpan of(int start, int end) {
        return new SourceSpan(start, end);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * True when the two spans share at least one offset. Adjacent spans
     * ({@code a.end == b.start}) do not overlap.
     */
    public boolean overlaps(SourceSpan other) {
        return start < other.end && other.start < end;
    }

    /**
     * Two edits over these spans cannot both be applied: either they overlap,
     * or both are insertions at the same offset and their order would be undefined.
     */
    public boolean conflictsWith(SourceSpan other) {
        if (overlaps(other)) return true;
        return isEmpty() && other.isEmpty() && start == other.start;
    }

    public boolean contains(SourceSpan other) {
        return start <= other.start && other.end <= end;
    }

    public boolean fitsIn(int bufferLength) {
        return end <= bufferLength;
    }

    public String slice(CharSequence buffer) {
        return buffer.subSequence(start, end).toString();
    }

    @Override
    public int compareTo(SourceSpan o) {
        int c = Integer.compare(start, o.start);
        return c != 0 ? c : Integer.compare(end, o.end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan that = (SourceSpan) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
