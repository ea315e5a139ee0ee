package com.heritagesync.core.reader;

/**
 * One row of a per-locale source file, as read, before any parsing or cleaning.
 *
 * <p>Every value is the raw string from the source (null when the field is absent).
 *
 * @param idNumber cross-locale property id
 * @param uniqueNumber source-assigned unique number
 * @param site property name in this locale
 * @param shortDescription description, may contain markup
 * @param states states parties text
 * @param location location text
 * @param justification justification, may contain markup
 * @param latitude latitude string
 * @param longitude longitude string
 * @param region region name
 * @param isoCode comma-separated ISO codes
 * @param category category label
 * @param criteriaText criteria text
 * @param dateInscribed year of inscription
 * @param secondaryDates secondary dates
 * @param danger danger period text, blank if not endangered
 * @param transboundary "1" if transboundary
 * @param extension extension counter
 * @param revision revision counter
 * @param httpUrl public page URL
 * @param imageUrl image URL
 */
public record RawSiteRecord(
    String idNumber,
    String uniqueNumber,
    String site,
    String shortDescription,
    String states,
    String location,
    String justification,
    String latitude,
    String longitude,
    String region,
    String isoCode,
    String category,
    String criteriaText,
    String dateInscribed,
    String secondaryDates,
    String danger,
    String transboundary,
    String extension,
    String revision,
    String httpUrl,
    String imageUrl
) {
}
