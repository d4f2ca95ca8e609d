package com.mocha.supporters.sync.model;

import java.time.Instant;
import java.util.List;

public record SupporterDataset(List<Supporter> sponsors, List<Supporter> backers, Instant generatedAt) {
    public SupporterDataset {
        sponsors = sponsors == null ? List.of() : List.copyOf(sponsors);
        backers = backers == null ? List.of() : List.copyOf(backers);
    }

    public int totalCount() {
        return sponsors.size() + backers.size();
    }
}
