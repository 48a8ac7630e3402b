package com.sparrowlogic.reachability.model;

import java.util.ArrayList;
import java.util.List;

// evaluation is null when the VPC pre-check already ruled the path out.
public record ConnectivityReport(
    ResourceDescriptor source,
    ResourceDescriptor destination,
    int port,
    boolean sameVpc,
    Evaluation evaluation
) {

    public enum Verdict {
        REACHABLE,
        BLOCKED,
        INCONCLUSIVE
    }

    public Verdict verdict() {
        if (!sameVpc) {
            return Verdict.BLOCKED;
        }
        if (evaluation.isReachable()) {
            return Verdict.REACHABLE;
        }
        return evaluation.failure().isPresent() ? Verdict.BLOCKED : Verdict.INCONCLUSIVE;
    }

    public boolean reachable() {
        return verdict() == Verdict.REACHABLE;
    }

    public List<String> lines() {
        var lines = new ArrayList<String>();
        if (!sameVpc) {
            lines.add("not in same VPC");
            return lines;
        }
        lines.add("in same VPC");
        if (evaluation.success().isPresent()) {
            lines.add(evaluation.success().get());
        } else if (evaluation.failure().isPresent()) {
            lines.add(evaluation.failure().get());
            lines.addAll(evaluation.context());
        } else {
            lines.addAll(evaluation.context());
        }
        return lines;
    }
}
