package com.e2eq.amper.core;

import com.e2eq.amper.iam.Policy;

import java.util.List;

/**
 * Outcome of a successful {@link Container#policy()} call.
 *
 * @param policy  the compressed policy bundle
 * @param missing attachments whose template rendered no document, in attachment order
 */
public record PolicyResult(Policy policy, List<Attachment> missing) {
    public PolicyResult {
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public boolean hasMissing() {
        return !missing.isEmpty();
    }
}
