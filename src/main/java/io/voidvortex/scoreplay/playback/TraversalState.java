package io.voidvortex.scoreplay.playback;

import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.Set;

/**
 * Immutable cursor-and-flags state of the measure traversal. Every transition produces a new
 * value, so a state can be fed to {@link MeasureTraversal#step} any number of times.
 *
 * @param cursor           index of the measure about to be visited
 * @param repeatStart      index of the most recent repeat start (0 when none was seen)
 * @param repeatedRanges   repeat ranges that have already been played twice
 * @param secondPassWindow range currently being replayed, inside which first endings are skipped
 * @param daCapoTaken      whether the single allowed DC jump happened
 * @param daSegnoTaken     whether the single allowed DS jump happened
 * @param jumped           set after a DC/DS jump; from then on Fine terminates
 * @param pass             pass counter reported with each visit
 */
public record TraversalState(int cursor,
                             int repeatStart,
                             Set<IndexRange> repeatedRanges,
                             @Nullable IndexRange secondPassWindow,
                             boolean daCapoTaken,
                             boolean daSegnoTaken,
                             boolean jumped,
                             int pass) {

    public static final TraversalState INITIAL =
            new TraversalState(0, 0, Set.of(), null, false, false, false, 1);

    /**
     * Inclusive range of measure indices.
     */
    public record IndexRange(int start, int end) {
        boolean contains(int index) {
            return index >= start && index <= end;
        }
    }

    public TraversalState {
        repeatedRanges = Set.copyOf(repeatedRanges);
    }

    TraversalState advance() {
        return moveTo(cursor + 1);
    }

    TraversalState moveTo(int index) {
        return new TraversalState(index, repeatStart, repeatedRanges, secondPassWindow,
                daCapoTaken, daSegnoTaken, jumped, pass);
    }

    TraversalState withRepeatStart(int index) {
        return new TraversalState(cursor, index, repeatedRanges, secondPassWindow,
                daCapoTaken, daSegnoTaken, jumped, pass);
    }

    TraversalState repeatBack(IndexRange range) {
        Set<IndexRange> ranges = new HashSet<>(repeatedRanges);
        ranges.add(range);
        return new TraversalState(range.start(), repeatStart, ranges, range,
                daCapoTaken, daSegnoTaken, jumped, pass + 1);
    }

    TraversalState closeSecondPass() {
        return new TraversalState(cursor, repeatStart, repeatedRanges, null,
                daCapoTaken, daSegnoTaken, jumped, pass);
    }

    TraversalState daCapo() {
        return new TraversalState(0, repeatStart, repeatedRanges, secondPassWindow,
                true, daSegnoTaken, true, pass + 1);
    }

    TraversalState dalSegno(int target) {
        return new TraversalState(target, repeatStart, repeatedRanges, secondPassWindow,
                daCapoTaken, true, true, pass + 1);
    }

    boolean skipsFirstEnding(int index) {
        return secondPassWindow != null && secondPassWindow.contains(index);
    }
}
