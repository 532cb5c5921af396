package com.bdi.pipeline.normalize;

/**
 * A raw record excluded from its batch.
 *
 * @param batchId batch the record was fetched in
 * @param position index of the record inside the batch
 * @param reasonCode rejection reason
 * @param detail human-readable detail
 */
public record Rejection(String batchId, int position, ReasonCode reasonCode, String detail) {}
