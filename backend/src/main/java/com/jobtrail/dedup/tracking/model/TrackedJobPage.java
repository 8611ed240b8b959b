package com.jobtrail.dedup.tracking.model;

import java.util.List;

public record TrackedJobPage(
    List<TrackedJobView> items,
    int pageSize,
    String nextCursor
) {
}
