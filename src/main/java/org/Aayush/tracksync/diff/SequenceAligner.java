package org.Aayush.tracksync.diff;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Aligns two sequences by recursively taking the longest common contiguous block
 * (Ratcliff/Obershelp) and reports the result as opcodes.
 *
 * <p>Memory stays linear in the input, unlike a full LCS table. Element equality is
 * {@link Object#equals(Object)}.</p>
 *
 * @param <T> element type, must implement {@code equals} and {@code hashCode}.
 */
public final class SequenceAligner<T> {
    private final List<T> left;
    private final List<T> right;
    private final Object2ObjectOpenHashMap<T, IntArrayList> rightIndex;

    public SequenceAligner(List<T> left, List<T> right) {
        this.left = List.copyOf(Objects.requireNonNull(left, "left"));
        this.right = List.copyOf(Objects.requireNonNull(right, "right"));
        this.rightIndex = new Object2ObjectOpenHashMap<>();
        for (int j = 0; j < this.right.size(); j++) {
            rightIndex.computeIfAbsent(this.right.get(j), key -> new IntArrayList()).add(j);
        }
    }

    /**
     * Matching blocks as {@code {leftStart, rightStart, length}}, ascending, adjacent
     * blocks joined, terminated by a zero-length block at both ends.
     */
    public List<int[]> matchingBlocks() {
        List<int[]> blocks = new ArrayList<>();
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, left.size(), 0, right.size()});
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int[] match = longestMatch(range[0], range[1], range[2], range[3]);
            int size = match[2];
            if (size == 0) {
                continue;
            }
            blocks.add(match);
            if (range[0] < match[0] && range[2] < match[1]) {
                queue.push(new int[]{range[0], match[0], range[2], match[1]});
            }
            if (match[0] + size < range[1] && match[1] + size < range[3]) {
                queue.push(new int[]{match[0] + size, range[1], match[1] + size, range[3]});
            }
        }
        blocks.sort(Comparator.<int[]>comparingInt(block -> block[0]).thenComparingInt(block -> block[1]));

        List<int[]> joined = new ArrayList<>();
        int[] current = null;
        for (int[] block : blocks) {
            if (current != null && current[0] + current[2] == block[0] && current[1] + current[2] == block[1]) {
                current[2] += block[2];
            } else {
                if (current != null) {
                    joined.add(current);
                }
                current = block.clone();
            }
        }
        if (current != null) {
            joined.add(current);
        }
        joined.add(new int[]{left.size(), right.size(), 0});
        return joined;
    }

    /**
     * Opcodes covering both sequences completely, in order.
     */
    public List<Opcode> opcodes() {
        List<Opcode> result = new ArrayList<>();
        int i = 0;
        int j = 0;
        for (int[] block : matchingBlocks()) {
            int leftStart = block[0];
            int rightStart = block[1];
            int size = block[2];
            Opcode.Tag tag = null;
            if (i < leftStart && j < rightStart) {
                tag = Opcode.Tag.REPLACE;
            } else if (i < leftStart) {
                tag = Opcode.Tag.DELETE;
            } else if (j < rightStart) {
                tag = Opcode.Tag.INSERT;
            }
            if (tag != null) {
                result.add(new Opcode(tag, i, leftStart, j, rightStart));
            }
            i = leftStart + size;
            j = rightStart + size;
            if (size > 0) {
                result.add(new Opcode(Opcode.Tag.EQUAL, leftStart, i, rightStart, j));
            }
        }
        return result;
    }

    // Returns {leftStart, rightStart, size}; earliest block wins among equally long ones.
    private int[] longestMatch(int leftLow, int leftHigh, int rightLow, int rightHigh) {
        int bestI = leftLow;
        int bestJ = rightLow;
        int bestSize = 0;
        Int2IntOpenHashMap lengths = new Int2IntOpenHashMap();
        for (int i = leftLow; i < leftHigh; i++) {
            Int2IntOpenHashMap newLengths = new Int2IntOpenHashMap();
            IntArrayList positions = rightIndex.get(left.get(i));
            if (positions != null) {
                for (int p = 0; p < positions.size(); p++) {
                    int j = positions.getInt(p);
                    if (j < rightLow) {
                        continue;
                    }
                    if (j >= rightHigh) {
                        break;
                    }
                    int k = lengths.get(j - 1) + 1;
                    newLengths.put(j, k);
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            lengths = newLengths;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
