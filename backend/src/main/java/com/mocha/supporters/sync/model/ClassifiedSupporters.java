package com.mocha.supporters.sync.model;

import java.util.List;

public record ClassifiedSupporters(List<Supporter> sponsors, List<Supporter> backers) {
    public ClassifiedSupporters {
        sponsors = sponsors == null ? List.of() : List.copyOf(sponsors);
        backers = backers == null ? List.of() : List.copyOf(backers);
    }
}
