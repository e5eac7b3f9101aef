package com.aiusage.canonicalizer.service.reporting;

/** Canonical field names the survey reports rely on. */
public final class SurveyFields {

  public static final String TIMESTAMP = "timestamp";
  public static final String DEPARTMENT = "department";
  public static final String JOB_ROLE = "job_role";
  public static final String AI_TOOL = "ai_tool";
  public static final String USAGE_FREQUENCY = "usage_frequency";
  public static final String PURPOSE = "purpose";
  public static final String EASE_OF_USE = "ease_of_use";
  public static final String EFFICIENCY = "efficiency";
  public static final String SUGGESTIONS = "suggestions";

  private SurveyFields() {}
}
