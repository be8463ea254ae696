package org.codegraph.shacl.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.codegraph.shacl.testutil.TestConstants.ARITY;
import static org.codegraph.shacl.testutil.TestConstants.FUNCTION;
import static org.codegraph.shacl.testutil.TestConstants.FUNCTION_1;
import static org.codegraph.shacl.testutil.TestConstants.FUNCTION_2;
import static org.codegraph.shacl.testutil.TestConstants.FUNCTION_NAME;
import static org.codegraph.shacl.testutil.TestConstants.MODULE_1;

import org.codegraph.shacl.vocabulary.Rdf;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for Graph and Triple.
 */
class GraphTest {

  @Test
  void of_shouldDropDuplicates_whenSameTripleAddedTwice() {
    // Given
    Triple triple = Triple.of(FUNCTION_1, ARITY, Literal.ofInteger(2));

    // When
    Graph graph = Graph.of(triple, triple, Triple.of(FUNCTION_1, ARITY, Literal.ofInteger(2)));

    // Then
    assertThat(graph.size()).isEqualTo(1);
    assertThat(graph.contains(triple)).isTrue();
  }

  @Test
  void triplesWith_shouldFilterBySubjectAndPredicate() {
    // Given
    Graph graph = Graph.builder()
        .add(FUNCTION_1, ARITY, Literal.ofInteger(2))
        .add(FUNCTION_1, FUNCTION_NAME, Literal.of("init"))
        .add(FUNCTION_2, ARITY, Literal.ofInteger(0))
        .build();

    // When / Then
    assertThat(graph.triplesWith(FUNCTION_1, null)).hasSize(2);
    assertThat(graph.triplesWith(null, ARITY)).hasSize(2);
    assertThat(graph.triplesWith(FUNCTION_1, ARITY))
        .containsExactly(Triple.of(FUNCTION_1, ARITY, Literal.ofInteger(2)));
    assertThat(graph.triplesWith(null, null)).hasSize(3);
    assertThat(graph.triplesWith(MODULE_1, null)).isEmpty();
  }

  @Test
  void objects_shouldPreserveInsertionOrder() {
    // Given
    Graph graph = Graph.builder()
        .add(MODULE_1, FUNCTION_NAME, Literal.of("b"))
        .add(MODULE_1, FUNCTION_NAME, Literal.of("a"))
        .add(MODULE_1, FUNCTION_NAME, Literal.of("c"))
        .build();

    // When / Then
    assertThat(graph.objects(MODULE_1, FUNCTION_NAME))
        .containsExactly(Literal.of("b"), Literal.of("a"), Literal.of("c"));
    assertThat(graph.objects(MODULE_1, ARITY)).isEmpty();
  }

  @Test
  void subjects_shouldReturnDistinctSubjects() {
    // Given
    Graph graph = Graph.builder()
        .add(FUNCTION_1, Rdf.TYPE, FUNCTION)
        .add(FUNCTION_2, Rdf.TYPE, FUNCTION)
        .add(MODULE_1, Rdf.TYPE, Rdf.RDFS_CLASS)
        .build();

    // When / Then
    assertThat(graph.subjects(Rdf.TYPE, FUNCTION)).containsExactly(FUNCTION_1, FUNCTION_2);
  }

  @Test
  void equals_shouldCompareTripleSets() {
    Graph first = Graph.of(Triple.of(FUNCTION_1, ARITY, Literal.ofInteger(1)));
    Graph second = Graph.builder().add(FUNCTION_1, ARITY, Literal.ofInteger(1)).build();

    assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    assertThat(Graph.empty().isEmpty()).isTrue();
  }

  @Test
  void triple_shouldRejectLiteralSubject() {
    assertThatThrownBy(() -> Triple.of(Literal.of("x"), ARITY, FUNCTION_1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("literal");
  }
}
