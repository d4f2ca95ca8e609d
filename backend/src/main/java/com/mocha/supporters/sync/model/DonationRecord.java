package com.mocha.supporters.sync.model;

import java.time.Instant;

/**
 * One ledger order as returned by the donation service, with its total already in minor units.
 */
public record DonationRecord(
    String id,
    String name,
    String slug,
    String website,
    String imgUrlMed,
    String imgUrlSmall,
    String type,
    long totalDonations,
    Instant firstDonation
) {
}
