package com.mocha.supporters.sync.model;

import java.time.Instant;

/**
 * Canonical supporter, one per slug. {@code avatar}, {@code avatarFile} and {@code dimensions}
 * are filled in by classification and asset sync.
 */
public record Supporter(
    String id,
    String name,
    String slug,
    String website,
    String imgUrlMed,
    String imgUrlSmall,
    String type,
    long totalDonations,
    Instant firstDonation,
    String avatar,
    String avatarFile,
    ImageDimensions dimensions
) {
    public static Supporter seed(DonationRecord record) {
        return new Supporter(
            record.id(),
            record.name(),
            record.slug(),
            record.website(),
            record.imgUrlMed(),
            record.imgUrlSmall(),
            record.type(),
            record.totalDonations(),
            record.firstDonation(),
            null,
            null,
            null
        );
    }

    public Supporter withTotalDonations(long total) {
        return new Supporter(id, name, slug, website, imgUrlMed, imgUrlSmall, type, total, firstDonation, avatar, avatarFile, dimensions);
    }

    public Supporter withAvatar(String avatarUrl) {
        return new Supporter(id, name, slug, website, imgUrlMed, imgUrlSmall, type, totalDonations, firstDonation, avatarUrl, avatarFile, dimensions);
    }

    public Supporter withAsset(String file, ImageDimensions imageDimensions) {
        return new Supporter(id, name, slug, website, imgUrlMed, imgUrlSmall, type, totalDonations, firstDonation, avatar, file, imageDimensions);
    }
}
