package com.heritagesync.core.reader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One record of the external component list, as read.
 *
 * <p>Coordinates are kept as strings; sources emit them either as JSON strings or numbers.
 *
 * @param whsId raw parent reference, possibly carrying a variant suffix ("1133bis", "1133-001")
 * @param componentUri URI identity of the component
 * @param label human-readable component name
 * @param lat latitude string
 * @param lon longitude string
 * @param source origin of the record in the external source ("component" or "site_self")
 * @param area optional area in square kilometres
 * @param designation optional protection designation
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawComponentRecord(
    @JsonProperty("whs_id") String whsId,
    @JsonProperty("component") String componentUri,
    @JsonProperty("componentLabel") String label,
    @JsonProperty("lat") String lat,
    @JsonProperty("lon") String lon,
    @JsonProperty("source") String source,
    @JsonProperty("area_km2") Double area,
    @JsonProperty("designation") String designation
) {
}
