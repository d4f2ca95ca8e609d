package com.mocha.supporters.sync.classify;

import com.mocha.supporters.sync.model.Bucket;
import com.mocha.supporters.sync.model.ClassifiedSupporters;
import com.mocha.supporters.sync.model.Supporter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits canonical supporters into sponsors and backers, richest first.
 * <p>
 * Individuals are backers, every other account type is a sponsor. Blocklisted slugs and
 * individuals literally named {@code anonymous} are left out of both lists.
 */
@Component
public class SupporterClassifier {
    static final String INDIVIDUAL = "INDIVIDUAL";
    static final String ANONYMOUS = "anonymous";

    private final Blocklist blocklist;

    public SupporterClassifier(Blocklist blocklist) {
        this.blocklist = blocklist == null ? Blocklist.empty() : blocklist;
    }

    public ClassifiedSupporters classify(List<Supporter> supporters) {
        if (supporters == null || supporters.isEmpty()) {
            return new ClassifiedSupporters(List.of(), List.of());
        }
        List<Supporter> ranked = new ArrayList<>(supporters.size());
        for (Supporter supporter : supporters) {
            if (!blocklist.contains(supporter.slug())) {
                ranked.add(supporter);
            }
        }
        // List.sort is stable: equal totals keep first-seen order.
        ranked.sort(Comparator.comparingLong(Supporter::totalDonations).reversed());

        List<Supporter> sponsors = new ArrayList<>();
        List<Supporter> backers = new ArrayList<>();
        for (Supporter supporter : ranked) {
            if (INDIVIDUAL.equals(supporter.type())) {
                if (!ANONYMOUS.equals(supporter.name())) {
                    backers.add(supporter.withAvatar(Bucket.BACKER.avatarSourceOf(supporter)));
                }
            } else {
                sponsors.add(supporter.withAvatar(Bucket.SPONSOR.avatarSourceOf(supporter)));
            }
        }
        return new ClassifiedSupporters(sponsors, backers);
    }
}
