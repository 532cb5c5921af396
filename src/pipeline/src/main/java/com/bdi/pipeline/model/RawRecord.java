package com.bdi.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Source-format payload of one observation, before normalization.
 *
 * @param batchId provenance tag of the batch the record was fetched in
 * @param batchSequence source order of that batch
 * @param position index of the record inside its batch
 * @param ingestedAt time the batch was fetched
 * @param payload opaque source payload
 */
public record RawRecord(
    String batchId,
    long batchSequence,
    int position,
    Instant ingestedAt,
    JsonNode payload) {}
