package org.codegraph.shacl.validator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.codegraph.shacl.testutil.TestConstants.CLAUSE_1;
import static org.codegraph.shacl.testutil.TestConstants.FUNCTION_1;
import static org.codegraph.shacl.testutil.TestConstants.FUNCTION_CLAUSE;
import static org.codegraph.shacl.testutil.TestConstants.HAS_CLAUSE;

import java.util.List;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Iri;
import org.codegraph.shacl.domain.Literal;
import org.codegraph.shacl.domain.NodeShape;
import org.codegraph.shacl.domain.PropertyShape;
import org.codegraph.shacl.domain.ValidationResult;
import org.codegraph.shacl.vocabulary.Rdf;
import org.codegraph.shacl.vocabulary.Sh;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for QualifiedValidator.
 */
class QualifiedValidatorTest {

  private static final Iri CLAUSE_2 = Iri.of("http://example.org/Clause2");

  private final QualifiedValidator validator = new QualifiedValidator();

  private static PropertyShape atLeastTwoClauses() {
    return PropertyShape.builder(HAS_CLAUSE)
        .qualifiedClass(FUNCTION_CLAUSE)
        .qualifiedMinCount(2)
        .build();
  }

  @Test
  void validate_shouldReportShortfall_whenTooFewQualifiedValues() {
    // Given
    Graph graph = Graph.builder()
        .add(FUNCTION_1, HAS_CLAUSE, CLAUSE_1)
        .add(FUNCTION_1, HAS_CLAUSE, CLAUSE_2)
        .add(CLAUSE_1, Rdf.TYPE, FUNCTION_CLAUSE)
        .build();

    // When
    List<ValidationResult> results = validator.validate(graph, FUNCTION_1, atLeastTwoClauses());

    // Then
    assertThat(results).singleElement().satisfies(r -> {
      assertThat(r.message()).isEqualTo("Property has too few values of required type "
          + "(expected at least 2 instances of " + FUNCTION_CLAUSE + ", found 1)");
      assertThat(r.constraintComponent()).isEqualTo(Sh.QUALIFIED_MIN_COUNT_COMPONENT);
      assertThat(r.details())
          .containsEntry("qualified_class", FUNCTION_CLAUSE)
          .containsEntry("qualified_min_count", 2)
          .containsEntry("actual_qualified_count", 1)
          .containsEntry("total_values", 2);
    });
  }

  @Test
  void validate_shouldAccept_whenEnoughQualifiedValues() {
    // Given
    Graph graph = Graph.builder()
        .add(FUNCTION_1, HAS_CLAUSE, CLAUSE_1)
        .add(FUNCTION_1, HAS_CLAUSE, CLAUSE_2)
        .add(CLAUSE_1, Rdf.TYPE, FUNCTION_CLAUSE)
        .add(CLAUSE_2, Rdf.TYPE, FUNCTION_CLAUSE)
        .build();

    // When / Then
    assertThat(validator.validate(graph, FUNCTION_1, atLeastTwoClauses())).isEmpty();
  }

  @Test
  void validate_shouldSkip_whenQualifiedClassMissing() {
    PropertyShape shape = PropertyShape.builder(HAS_CLAUSE).qualifiedMinCount(2).build();

    assertThat(validator.validate(Graph.empty(), FUNCTION_1, shape)).isEmpty();
  }

  @Test
  void validate_shouldReturnEmpty_whenPropertyShapeHasNoConstraints() {
    // Given
    PropertyShape shape = PropertyShape.builder(HAS_CLAUSE).build();
    Graph graph = Graph.builder()
        .add(FUNCTION_1, HAS_CLAUSE, CLAUSE_1)
        .add(CLAUSE_1, Rdf.TYPE, FUNCTION_CLAUSE)
        .build();

    // When
    List<ValidationResult> forResource = validator.validate(graph, FUNCTION_1, shape);
    List<ValidationResult> forLiteral = validator.validate(graph, Literal.of("x"), shape);

    // Then
    assertThat(forResource).isEmpty();
    assertThat(forLiteral).isEmpty();
  }

  @Test
  void validateNode_shouldReturnEmpty_whenNodeShapeHasNoConstraints() {
    // Given
    NodeShape shape = NodeShape.builder(FUNCTION_1).build();
    Graph graph = Graph.builder()
        .add(FUNCTION_1, HAS_CLAUSE, CLAUSE_1)
        .add(CLAUSE_1, Rdf.TYPE, FUNCTION_CLAUSE)
        .build();

    // When
    List<ValidationResult> forResource = validator.validateNode(graph, FUNCTION_1, shape);
    List<ValidationResult> forLiteral = validator.validateNode(graph, Literal.of("x"), shape);

    // Then
    assertThat(forResource).isEmpty();
    assertThat(forLiteral).isEmpty();
  }
}
