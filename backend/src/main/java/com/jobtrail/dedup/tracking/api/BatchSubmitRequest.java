package com.jobtrail.dedup.tracking.api;

import com.jobtrail.dedup.tracking.model.RawJobRecord;

import java.util.List;

public record BatchSubmitRequest(
    String scrapeRunId,
    String sourcePlatform,
    List<RawJobRecord> records
) {
}
