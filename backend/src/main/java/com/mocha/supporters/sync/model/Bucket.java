package com.mocha.supporters.sync.model;

import java.util.function.Function;

public enum Bucket {
    SPONSOR(Supporter::imgUrlMed, true),
    BACKER(Supporter::imgUrlSmall, false);

    private final Function<Supporter, String> avatarSource;
    private final boolean readsDimensions;

    Bucket(Function<Supporter, String> avatarSource, boolean readsDimensions) {
        this.avatarSource = avatarSource;
        this.readsDimensions = readsDimensions;
    }

    public String avatarSourceOf(Supporter supporter) {
        return avatarSource.apply(supporter);
    }

    public boolean readsDimensions() {
        return readsDimensions;
    }
}
