package com.example.governance.degradation;

import java.util.List;

/** Feature names managed by the level catalog. */
public final class Features {

    public static final String ADVANCED_ANALYTICS = "advanced_analytics";
    public static final String REAL_TIME_PROCESSING = "real_time_processing";
    public static final String COMPLEX_QUERIES = "complex_queries";
    public static final String BACKGROUND_JOBS = "background_jobs";
    public static final String NOTIFICATIONS = "notifications";
    public static final String REPORTING = "reporting";
    public static final String FILE_UPLOADS = "file_uploads";
    public static final String DATA_EXPORT = "data_export";

    public static final List<String> ALL = List.of(
            ADVANCED_ANALYTICS,
            REAL_TIME_PROCESSING,
            COMPLEX_QUERIES,
            BACKGROUND_JOBS,
            NOTIFICATIONS,
            REPORTING,
            FILE_UPLOADS,
            DATA_EXPORT);

    private Features() {
    }
}
