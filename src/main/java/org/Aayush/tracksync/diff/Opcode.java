package org.Aayush.tracksync.diff;

/**
 * One aligned run: {@code left[leftStart, leftEnd)} relates to {@code right[rightStart, rightEnd)}.
 */
public record Opcode(Tag tag, int leftStart, int leftEnd, int rightStart, int rightEnd) {

    public enum Tag {
        EQUAL,
        REPLACE,
        /** Present only on the left. */
        DELETE,
        /** Present only on the right. */
        INSERT
    }

    public int leftLength() {
        return leftEnd - leftStart;
    }

    public int rightLength() {
        return rightEnd - rightStart;
    }
}
