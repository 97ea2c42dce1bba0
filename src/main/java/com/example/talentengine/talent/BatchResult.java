package com.example.talentengine.talent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of applying a sequence of modifiers. Results are kept in application order.
 */
public class BatchResult {
    private final List<ApplyResult> results = new ArrayList<>();

    void add(ApplyResult result) {
        results.add(result);
    }

    public List<ApplyResult> getResults() { return Collections.unmodifiableList(results); }

    public int getAppliedCount() {
        int n = 0;
        for (ApplyResult r : results) if (r.isApplied()) n++;
        return n;
    }

    public List<ApplyResult> getFailures() {
        List<ApplyResult> out = new ArrayList<>();
        for (ApplyResult r : results) if (r.isFailure()) out.add(r);
        return out;
    }

    public boolean hasFailures() {
        for (ApplyResult r : results) if (r.isFailure()) return true;
        return false;
    }

    public int size() { return results.size(); }
}
