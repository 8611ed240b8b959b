package com.jobtrail.dedup.tracking.model;

/**
 * @param index position of the record in the submitted batch
 */
public record RecordRejection(
    int index,
    String externalId,
    String reason,
    String detail
) {
}
