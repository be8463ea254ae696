package org.codegraph.shacl.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one validation run, with results bucketed by severity.
 *
 * @param conforms true if no violation was found
 * @param violations results with severity VIOLATION
 * @param warnings results with severity WARNING
 * @param info results with severity INFO
 */
public record ValidationReport(
    boolean conforms,
    List<ValidationResult> violations,
    List<ValidationResult> warnings,
    List<ValidationResult> info) {

  /**
   * Creates a new ValidationReport with validation.
   *
   * @throws IllegalArgumentException if a result sits in the wrong severity bucket
   */
  public ValidationReport {
    violations = List.copyOf(Objects.requireNonNull(violations, "violations cannot be null"));
    warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings cannot be null"));
    info = List.copyOf(Objects.requireNonNull(info, "info cannot be null"));
    requireSeverity(violations, Severity.VIOLATION);
    requireSeverity(warnings, Severity.WARNING);
    requireSeverity(info, Severity.INFO);
  }

  private static void requireSeverity(List<ValidationResult> results, Severity expected) {
    for (ValidationResult result : results) {
      if (result.severity() != expected) {
        throw new IllegalArgumentException(
            "Result with severity " + result.severity() + " in " + expected + " bucket");
      }
    }
  }

  /**
   * Builds a report from results of any severity. The report conforms iff there
   * is no violation.
   *
   * @param results the results, in output order
   * @return a new report
   */
  public static ValidationReport of(Collection<ValidationResult> results) {
    List<ValidationResult> violations = new ArrayList<>();
    List<ValidationResult> warnings = new ArrayList<>();
    List<ValidationResult> info = new ArrayList<>();
    for (ValidationResult result : results) {
      switch (result.severity()) {
        case VIOLATION -> violations.add(result);
        case WARNING -> warnings.add(result);
        case INFO -> info.add(result);
        default -> throw new IllegalStateException("Unknown severity: " + result.severity());
      }
    }
    return new ValidationReport(violations.isEmpty(), violations, warnings, info);
  }

  /**
   * Creates a conforming report with no results.
   *
   * @return an empty conforming report
   */
  public static ValidationReport conforming() {
    return new ValidationReport(true, List.of(), List.of(), List.of());
  }

  public int issueCount() {
    return violations.size() + warnings.size() + info.size();
  }

  public boolean hasViolations() {
    return !violations.isEmpty();
  }

  /**
   * Gets all results: violations, then warnings, then info.
   *
   * @return all results
   */
  public List<ValidationResult> results() {
    List<ValidationResult> all = new ArrayList<>(issueCount());
    all.addAll(violations);
    all.addAll(warnings);
    all.addAll(info);
    return List.copyOf(all);
  }
}
