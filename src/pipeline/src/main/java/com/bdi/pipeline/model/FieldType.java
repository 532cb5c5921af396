package com.bdi.pipeline.model;

/** Value tag of a {@link FieldValue}. */
public enum FieldType {
  DOUBLE,
  LONG,
  TEXT,
  BOOLEAN
}
