package io.voidvortex.scoreplay.playback;

import java.util.List;

public record ResolverResult(List<MeasureVisit> order, Termination terminatedBy) {

    public static final ResolverResult EMPTY = new ResolverResult(List.of(), Termination.END_OF_SCORE);

    public ResolverResult {
        order = List.copyOf(order);
    }

    public List<String> measureIds() {
        return order.stream().map(MeasureVisit::measureId).toList();
    }
}
