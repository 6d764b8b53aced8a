package io.voidvortex.scoreplay.playback;

import io.voidvortex.scoreplay.DebugSink;
import io.voidvortex.scoreplay.score.Measure;
import io.voidvortex.scoreplay.score.NavigationMarker;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands repeats, first/second endings and DC/DS/Fine navigation of one staff into a linear
 * list of measure visits. This class is purely structural; it never looks at voice content.
 * <p>
 * Repeats play exactly twice, DC and DS each fire at most once. Anything the flag set cannot
 * express (several Fine targets after a second DS, coda jumps) is outside this model. A
 * pathological graph is cut off by {@code maxVisits} and reported as
 * {@link Termination#SAFETY_LIMIT}; this class never throws for musical reasons.
 */
public final class MeasureTraversal {

    public static final int DEFAULT_MAX_VISITS = 2048;

    private MeasureTraversal() {
    }

    /**
     * Result of one transition. {@code visit} is null when the measure was skipped,
     * {@code terminatedBy} is non-null once the traversal is over.
     */
    public record Transition(TraversalState next,
                             @Nullable MeasureVisit visit,
                             @Nullable Termination terminatedBy) {
    }

    // ───────────────────────── public API ────────────────────────────────

    public static ResolverResult resolve(List<Measure> measures) {
        return resolve(measures, DEFAULT_MAX_VISITS, DebugSink.NOOP);
    }

    public static ResolverResult resolve(List<Measure> measures, int maxVisits) {
        return resolve(measures, maxVisits, DebugSink.NOOP);
    }

    public static ResolverResult resolve(List<Measure> measures, int maxVisits, DebugSink sink) {
        DebugSink dbg = (sink != null ? sink : DebugSink.NOOP).prefixed("[traversal] ");
        if (measures.isEmpty())
            return ResolverResult.EMPTY;

        List<MeasureVisit> order = new ArrayList<>();
        TraversalState state = TraversalState.INITIAL;
        int visits = 0;
        while (state.cursor() < measures.size()) {
            if (++visits > maxVisits) {
                dbg.log(String.format("safety limit of %d visits reached at index %d", maxVisits, state.cursor()));
                return new ResolverResult(order, Termination.SAFETY_LIMIT);
            }
            Transition t = step(measures, state);
            if (t.visit() != null)
                order.add(t.visit());
            if (t.terminatedBy() != null) {
                dbg.log(t.terminatedBy() + " after " + order.size() + " visits");
                return new ResolverResult(order, t.terminatedBy());
            }
            if (t.next().pass() != state.pass())
                dbg.log(String.format("jump %d -> %d, pass %d", state.cursor(), t.next().cursor(), t.next().pass()));
            state = t.next();
        }
        return new ResolverResult(order, Termination.END_OF_SCORE);
    }

    /**
     * Single transition of the traversal state machine.
     */
    public static Transition step(List<Measure> measures, TraversalState state) {
        int idx = state.cursor();
        if (idx >= measures.size())
            return new Transition(state, null, Termination.END_OF_SCORE);

        Measure measure = measures.get(idx);
        // first ending is suppressed while its range is being replayed
        if (measure.isVolta(1) && state.skipsFirstEnding(idx))
            return new Transition(state.advance(), null, null);

        MeasureVisit visit = new MeasureVisit(measure.id(), state.pass());
        if (state.jumped() && measure.hasMarker(NavigationMarker.FINE))
            return new Transition(state, visit, Termination.FINE);

        TraversalState s = state;
        if (measure.repeatStart())
            s = s.withRepeatStart(idx);

        if (measure.repeatEnd()) {
            TraversalState.IndexRange range = new TraversalState.IndexRange(s.repeatStart(), idx);
            if (!s.repeatedRanges().contains(range))
                return new Transition(s.repeatBack(range), visit, null);
            s = s.closeSecondPass();
        }

        if (measure.hasMarker(NavigationMarker.DC) && !s.daCapoTaken())
            return new Transition(s.daCapo(), visit, null);

        if (measure.hasMarker(NavigationMarker.DS) && idx > 0 && !s.daSegnoTaken())
            return new Transition(s.dalSegno(segnoTarget(measures, idx)), visit, null);

        return new Transition(s.advance(), visit, null);
    }

    // ────────────────────────── inner helpers ────────────────────────────

    /**
     * Nearest earlier measure carrying the sign, or the first measure.
     */
    static int segnoTarget(List<Measure> measures, int instructionIdx) {
        for (int i = instructionIdx - 1; i >= 0; i--) {
            if (measures.get(i).hasMarker(NavigationMarker.DS))
                return i;
        }
        return 0;
    }
}
