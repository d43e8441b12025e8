package com.flamingo.ai.reportingest.service.ingestion.quality;

/** Accept or reject decision with the reason behind it. */
public record QualityVerdict(boolean accepted, String reason) {

  private static final QualityVerdict OK = new QualityVerdict(true, "OK");

  public static QualityVerdict ok() {
    return OK;
  }

  public static QualityVerdict reject(String reason) {
    return new QualityVerdict(false, reason);
  }
}
