package com.mocha.supporters.sync.aggregate;

import com.mocha.supporters.sync.model.DonationRecord;
import com.mocha.supporters.sync.model.Supporter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Folds raw ledger orders into one supporter per key. The first order seen for a key supplies
 * the identity fields and the output position; later orders only add to its total.
 */
@Component
public class SupporterAggregator {

    public List<Supporter> aggregate(List<DonationRecord> records) {
        return aggregate(records, DonationRecord::slug);
    }

    public List<Supporter> aggregate(List<DonationRecord> records, Function<DonationRecord, String> keyExtractor) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        Map<String, Accumulator> byKey = new LinkedHashMap<>();
        for (DonationRecord record : records) {
            String key = keyExtractor.apply(record);
            if (key == null) {
                throw new IllegalArgumentException("Donation record " + record.id() + " has no aggregation key");
            }
            Accumulator existing = byKey.get(key);
            if (existing == null) {
                byKey.put(key, new Accumulator(record));
            } else {
                existing.add(record.totalDonations());
            }
        }
        List<Supporter> supporters = new ArrayList<>(byKey.size());
        for (Accumulator accumulator : byKey.values()) {
            supporters.add(accumulator.toSupporter());
        }
        return supporters;
    }

    private static final class Accumulator {
        private final DonationRecord seed;
        private long total;

        private Accumulator(DonationRecord seed) {
            this.seed = seed;
            this.total = seed.totalDonations();
        }

        private void add(long amount) {
            total = Math.addExact(total, amount);
        }

        private Supporter toSupporter() {
            return Supporter.seed(seed).withTotalDonations(total);
        }
    }
}
