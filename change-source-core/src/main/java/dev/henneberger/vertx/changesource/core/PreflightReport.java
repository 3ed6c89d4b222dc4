package dev.henneberger.vertx.changesource.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class PreflightReport {
  private final List<PreflightIssue> issues;

  public PreflightReport(List<PreflightIssue> issues) {
    Objects.requireNonNull(issues, "issues");
    this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
  }

  public boolean ok() {
    for (PreflightIssue issue : issues) {
      if (issue.severity() == PreflightIssue.Severity.ERROR) {
        return false;
      }
    }
    return true;
  }

  public List<PreflightIssue> issues() {
    return issues;
  }

  public boolean hasIssue(String code) {
    return issues.stream().anyMatch(issue -> issue.code().equals(code));
  }

  public String describe() {
    if (ok()) {
      return "Preflight passed";
    }
    return "Preflight failed: " + issues.stream()
      .filter(issue -> issue.severity() == PreflightIssue.Severity.ERROR)
      .map(PreflightIssue::toString)
      .collect(Collectors.joining("; "));
  }
}
