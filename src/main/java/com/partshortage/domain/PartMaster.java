package com.partshortage.domain;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Part master merged per {@link PartKey}: display number and name plus every routing
 * step (work center) the part passes through.
 */
public record PartMaster(
    PartKey part,
    String partNumber,
    String name,
    String warehouse,
    SortedSet<String> routingSteps
) {

    public PartMaster {
        routingSteps = Collections.unmodifiableSortedSet(
            routingSteps == null ? new TreeSet<String>() : new TreeSet<>(routingSteps));
    }

    public static PartMaster bare(PartKey part) {
        return new PartMaster(part, part.value(), "", "", new TreeSet<>());
    }

    public boolean passesThrough(String stepCode) {
        return stepCode != null && routingSteps.contains(stepCode.trim());
    }

    public String routingLabel() {
        return String.join(",", routingSteps);
    }
}
