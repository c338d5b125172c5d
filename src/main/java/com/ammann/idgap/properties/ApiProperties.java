/* (C)2026 */
package com.ammann.idgap.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 *
 * <p>Organizes endpoints by functional area to ensure consistent path naming and
 * simplify path refactoring.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /** CSV export endpoint path. */
    public static final String EXPORT_CSV = "/export/csv";

    /**
     * Per-entity ID space endpoints
     */
    public static final class Entities {
        private Entities() {}

        public static final String BASE = "/entities/{entityId}";
        public static final String GAP_ANALYSIS = "/gap-analysis";
        public static final String GAP_EXPORT = GAP_ANALYSIS + EXPORT_CSV;
        public static final String BOUNDS = "/bounds";
        public static final String ID_STATUSES = "/id-statuses";
        public static final String EXISTING_IDS = "/existing-ids";
    }
}
