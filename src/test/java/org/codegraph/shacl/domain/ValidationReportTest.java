package org.codegraph.shacl.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.codegraph.shacl.testutil.TestConstants.FUNCTION_1;

import java.util.List;
import java.util.Map;
import org.codegraph.shacl.vocabulary.Sh;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ValidationReport, ValidationResult and Severity.
 */
class ValidationReportTest {

  private static ValidationResult result(Severity severity) {
    return ValidationResult.builder(FUNCTION_1).severity(severity).message("m").build();
  }

  @Test
  void of_shouldPartitionBySeverity() {
    // Given
    List<ValidationResult> results = List.of(
        result(Severity.WARNING), result(Severity.VIOLATION),
        result(Severity.INFO), result(Severity.VIOLATION));

    // When
    ValidationReport report = ValidationReport.of(results);

    // Then
    assertThat(report.conforms()).isFalse();
    assertThat(report.hasViolations()).isTrue();
    assertThat(report.violations()).hasSize(2);
    assertThat(report.warnings()).hasSize(1);
    assertThat(report.info()).hasSize(1);
    assertThat(report.issueCount()).isEqualTo(4);
    assertThat(report.results()).hasSize(4);
  }

  @Test
  void of_shouldConform_whenOnlyWarningsAndInfo() {
    ValidationReport report = ValidationReport.of(
        List.of(result(Severity.WARNING), result(Severity.INFO)));

    assertThat(report.conforms()).isTrue();
    assertThat(report.hasViolations()).isFalse();
    assertThat(report.issueCount()).isEqualTo(2);
  }

  @Test
  void constructor_shouldRejectResultInWrongBucket() {
    assertThatThrownBy(() -> new ValidationReport(false,
        List.of(result(Severity.WARNING)), List.of(), List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void conforming_shouldBeEmpty() {
    ValidationReport report = ValidationReport.conforming();

    assertThat(report.conforms()).isTrue();
    assertThat(report.issueCount()).isZero();
  }

  @Test
  void result_shouldDefaultMessageAndCopyDetails() {
    // Given
    Map<String, Object> details = new java.util.HashMap<>();
    details.put("actual_value", "x");

    // When
    ValidationResult result = new ValidationResult(FUNCTION_1, null, null, null,
        Severity.VIOLATION, null, Sh.PATTERN_COMPONENT, details);
    details.put("later", "y");

    // Then
    assertThat(result.message()).isEmpty();
    assertThat(result.details()).containsOnlyKeys("actual_value");
    assertThatThrownBy(() -> result.details().put("k", "v"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void severity_shouldDefaultToViolation_whenIriUnknown() {
    assertThat(Severity.fromIri(Sh.WARNING)).isEqualTo(Severity.WARNING);
    assertThat(Severity.fromIri(Sh.INFO)).isEqualTo(Severity.INFO);
    assertThat(Severity.fromIri(Sh.VIOLATION)).isEqualTo(Severity.VIOLATION);
    assertThat(Severity.fromIri(Iri.of("http://example.org/Critical")))
        .isEqualTo(Severity.VIOLATION);
    assertThat(Severity.fromIri(null)).isEqualTo(Severity.VIOLATION);
  }
}
