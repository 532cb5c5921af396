package com.bdi.pipeline.normalize;

/** Why a raw record was rejected by the normalizer. Used as a low-cardinality metric tag. */
public enum ReasonCode {
  MALFORMED_PAYLOAD,
  MISSING_ENTITY_ID,
  INVALID_ENTITY_ID,
  MISSING_TIMESTAMP,
  UNPARSEABLE_TIMESTAMP,
  FIELD_TYPE_MISMATCH,
  FIELD_OUT_OF_RANGE
}
