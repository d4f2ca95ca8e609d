package com.mocha.supporters.sync.classify;

import java.util.Collection;
import java.util.Set;

/**
 * Slugs excluded from the published supporter list.
 */
public record Blocklist(Set<String> slugs) {
    public Blocklist {
        slugs = slugs == null ? Set.of() : Set.copyOf(slugs);
    }

    public static Blocklist empty() {
        return new Blocklist(Set.of());
    }

    public static Blocklist of(Collection<String> slugs) {
        return new Blocklist(slugs == null ? Set.of() : Set.copyOf(slugs));
    }

    public boolean contains(String slug) {
        return slug != null && slugs.contains(slug);
    }

    public int size() {
        return slugs.size();
    }
}
