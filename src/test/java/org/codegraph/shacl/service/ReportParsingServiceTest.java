package org.codegraph.shacl.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.codegraph.shacl.testutil.TestConstants.FUNCTION_1;
import static org.codegraph.shacl.testutil.TestConstants.PREFIXES;

import org.codegraph.shacl.domain.Literal;
import org.codegraph.shacl.domain.Severity;
import org.codegraph.shacl.domain.ValidationReport;
import org.codegraph.shacl.exception.RdfParseException;
import org.codegraph.shacl.exception.ReportParseException;
import org.codegraph.shacl.testutil.ExpectedLogContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ReportParsingService.
 */
class ReportParsingServiceTest {

  private ReportParsingService service;

  @BeforeEach
  void setUp() {
    service = new ReportParsingService(new RdfParsingService());
  }

  @Test
  void parse_shouldReadResultsBySeverity() {
    // Given
    String turtle = PREFIXES + """
        [] a sh:ValidationReport ;
           sh:conforms false ;
           sh:result [
             a sh:ValidationResult ;
             sh:focusNode ex:Function1 ;
             sh:resultPath struct:arity ;
             sh:value "two" ;
             sh:resultSeverity sh:Violation ;
             sh:resultMessage "Arity must be an integer"
           ] , [
             a sh:ValidationResult ;
             sh:focusNode ex:Module1 ;
             sh:resultSeverity sh:Warning
           ] .
        """;

    // When
    ValidationReport report = service.parse(turtle);

    // Then
    assertThat(report.conforms()).isFalse();
    assertThat(report.violations()).singleElement().satisfies(r -> {
      assertThat(r.focusNode()).isEqualTo(FUNCTION_1);
      assertThat(r.value()).isEqualTo(Literal.of("two"));
      assertThat(r.message()).isEqualTo("Arity must be an integer");
    });
    assertThat(report.warnings()).singleElement()
        .satisfies(r -> assertThat(r.message()).isEmpty());
    assertThat(report.info()).isEmpty();
  }

  @Test
  void parse_shouldDefaultToViolation_whenSeverityUnknown() {
    // Given
    String turtle = PREFIXES + """
        [] sh:conforms false ;
           sh:result [ sh:focusNode ex:Function1 ; sh:resultSeverity ex:Critical ] .
        """;

    // When
    ValidationReport report = service.parse(turtle);

    // Then
    assertThat(report.violations()).singleElement()
        .satisfies(r -> assertThat(r.severity()).isEqualTo(Severity.VIOLATION));
  }

  @Test
  void parse_shouldAcceptNumericBoolean() {
    String turtle = PREFIXES + "[] sh:conforms \"1\"^^xsd:boolean .";

    assertThat(service.parse(turtle).conforms()).isTrue();
  }

  @Test
  void parse_shouldThrow_whenNoReportNode() {
    String turtle = PREFIXES + "ex:Module1 struct:moduleName \"MyApp\" .";

    assertThatThrownBy(() -> service.parse(turtle))
        .isInstanceOf(ReportParseException.class)
        .hasMessage("No validation report found");
  }

  @Test
  void parse_shouldThrow_whenConformsValueInvalid() {
    String turtle = PREFIXES + "[] sh:conforms \"maybe\" .";

    assertThatThrownBy(() -> service.parse(turtle))
        .isInstanceOf(ReportParseException.class)
        .hasMessageStartingWith("Invalid sh:conforms value");
  }

  @Test
  void parse_shouldThrow_whenResultHasNoFocusNode() {
    String turtle = PREFIXES + "[] sh:conforms false ; sh:result [ sh:resultSeverity sh:Info ] .";

    assertThatThrownBy(() -> service.parse(turtle))
        .isInstanceOf(ReportParseException.class)
        .hasMessageContaining("has no sh:focusNode");
  }

  @Test
  void parse_shouldWrapSyntaxErrors() {
    try (var ignored = ExpectedLogContext.expect("Undefined prefix")) {
      assertThatThrownBy(() -> service.parse("[] sh:conforms true ."))
          .isInstanceOf(ReportParseException.class)
          .hasCauseInstanceOf(RdfParseException.class)
          .satisfies(e -> assertThat(((ReportParseException) e).getCode())
              .isEqualTo("invalid_report"));
    }
  }
}
