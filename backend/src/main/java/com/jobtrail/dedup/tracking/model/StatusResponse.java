package com.jobtrail.dedup.tracking.model;

import java.util.Map;

public record StatusResponse(
    boolean dbConnectivity,
    Map<String, Long> counts,
    IngestionRunStatus latestRun
) {
}
