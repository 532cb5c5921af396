package com.bdi.api.archive;

import java.time.LocalDate;

enum NoRawArchive implements RawArchive {
  INSTANCE;

  @Override
  public void prepare(LocalDate day) {}

  @Override
  public void store(LocalDate day, String fileName, byte[] content) {}
}
