package com.mocha.supporters.sync.aggregate;

import com.mocha.supporters.sync.model.DonationRecord;
import com.mocha.supporters.sync.model.Supporter;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SupporterAggregatorTest {
    private final SupporterAggregator aggregator = new SupporterAggregator();

    @Test
    void sumsTotalsOfRepeatedSlugsInFirstSeenOrder() {
        List<Supporter> supporters = aggregator.aggregate(List.of(
            record("id-a1", "a", "First A", 100),
            record("id-b", "b", "B", 50),
            record("id-a2", "a", "Second A", 25)
        ));

        assertThat(supporters).extracting(Supporter::slug).containsExactly("a", "b");
        assertThat(supporters).extracting(Supporter::totalDonations).containsExactly(125L, 50L);
    }

    @Test
    void keepsIdentityFieldsOfFirstRecord() {
        List<Supporter> supporters = aggregator.aggregate(List.of(
            record("id-a1", "a", "First A", 100),
            record("id-a2", "a", "Second A", 25)
        ));

        Supporter a = supporters.get(0);
        assertThat(a.id()).isEqualTo("id-a1");
        assertThat(a.name()).isEqualTo("First A");
        assertThat(a.firstDonation()).isEqualTo(Instant.parse("2019-01-01T00:00:00Z"));
        assertThat(a.avatar()).isNull();
        assertThat(a.avatarFile()).isNull();
        assertThat(a.dimensions()).isNull();
    }

    @Test
    void manySmallDonationsSumWithoutDrift() {
        List<DonationRecord> records = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            records.add(record("id-" + i, "frequent", "Frequent", 10));
        }

        List<Supporter> supporters = aggregator.aggregate(records);

        assertThat(supporters).hasSize(1);
        assertThat(supporters.get(0).totalDonations()).isEqualTo(10_000L);
    }

    @Test
    void supportsCustomKeys() {
        List<Supporter> supporters = aggregator.aggregate(
            List.of(record("same", "x", "X", 5), record("same", "y", "Y", 7)),
            DonationRecord::id
        );

        assertThat(supporters).hasSize(1);
        assertThat(supporters.get(0).slug()).isEqualTo("x");
        assertThat(supporters.get(0).totalDonations()).isEqualTo(12L);
    }

    @Test
    void rejectsRecordsWithoutKey() {
        assertThatThrownBy(() -> aggregator.aggregate(List.of(record("id-1", null, "Nameless", 1))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("id-1");
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertThat(aggregator.aggregate(List.of())).isEmpty();
        assertThat(aggregator.aggregate(null)).isEmpty();
    }

    private DonationRecord record(String id, String slug, String name, long total) {
        return new DonationRecord(
            id,
            name,
            slug,
            null,
            "https://images.example/" + slug + "/64.png",
            "https://images.example/" + slug + "/32.png",
            "INDIVIDUAL",
            total,
            Instant.parse("2019-01-01T00:00:00Z")
        );
    }
}
