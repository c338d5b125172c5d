/* (C)2026 */
package com.ammann.idgap.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Entity owning an ID space, with the URL template used to rebuild per-ID source URLs.
 *
 * @param id entity identifier
 * @param entityName display name, used in export file names
 * @param urlDomain scheme and host of the source site (e.g. {@code https://example.com})
 * @param urlPath path of the per-ID page (e.g. {@code /tournament})
 */
@Schema(description = "Entity configuration")
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntityConfigDTO(
        @Schema(description = "Entity identifier") String id,
        @Schema(description = "Entity display name") String entityName,
        @Schema(description = "Source URL domain") String urlDomain,
        @Schema(description = "Source URL path") String urlPath) {

    /**
     * Builds the source URL of a single ID.
     *
     * @param recordId ID to substitute into the template
     * @return {@code urlDomain + urlPath + "?id=" + recordId}
     */
    public String urlFor(long recordId) {
        return nullToEmpty(urlDomain) + nullToEmpty(urlPath) + "?id=" + recordId;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
