package io.taintscan.model;

import java.util.List;

/**
 * Roll-up of every path starting at one entry point, across all sinks it reaches.
 *
 * @param entryId    Id of the path root
 * @param registered Whether the root is a registered entry point
 * @param sinkIds    Sinks reached from this root, in sink declaration order
 * @param overall    Worst-live-path verdict over all paths from this root
 * @param reasons    Distinct live-path verdict kinds, {@code [DEAD]} when none is live
 * @param rationale  Path counts as prose
 */
public record EntryPointVerdict(
        String entryId,
        boolean registered,
        List<String> sinkIds,
        OverallVerdict overall,
        List<PathVerdict> reasons,
        String rationale
) {
    public EntryPointVerdict {
        sinkIds = sinkIds == null ? List.of() : List.copyOf(sinkIds);
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
