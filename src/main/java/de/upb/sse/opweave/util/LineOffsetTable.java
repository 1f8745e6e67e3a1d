package de.upb.sse.opweave.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between 1-based line/column positions and 0-based buffer offsets.
 * {@code \n}, {@code \r\n} and a lone {@code \r} each end a line.
 */
public class LineOffsetTable {
    private final int[] lineStarts;
    private final int length;

    public LineOffsetTable(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') i++;
                starts.add(i + 1);
            } else if (c == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        this.length = text.length();
    }

    public int getLineCount() {
        return lineStarts.length;
    }

    public int offsetOf(int line, int column) {
        if (line < 1 || line > lineStarts.length) {
            throw new IllegalArgumentException("line " + line + " outside 1.." + lineStarts.length);
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be positive: " + column);
        }
        int offset = lineStarts[line - 1] + column - 1;
        if (offset > length) {
            throw new IllegalArgumentException("position " + line + ":" + column + " lies past the end of the text");
        }
        return offset;
    }

    public int lineOf(int offset) {
        checkOffset(offset);
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    public int columnOf(int offset) {
        return offset - lineStarts[lineOf(offset) - 1] + 1;
    }

    private void checkOffset(int offset) {
        if (offset < 0 || offset > length) {
            throw new IllegalArgumentException("offset " + offset + " outside 0.." + length);
        }
    }
}
