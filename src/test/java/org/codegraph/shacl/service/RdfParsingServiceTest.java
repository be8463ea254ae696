package org.codegraph.shacl.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.codegraph.shacl.testutil.TestConstants.ARITY;
import static org.codegraph.shacl.testutil.TestConstants.FUNCTION_1;
import static org.codegraph.shacl.testutil.TestConstants.MODULE_1;
import static org.codegraph.shacl.testutil.TestConstants.MODULE_NAME;
import static org.codegraph.shacl.testutil.TestConstants.PREFIXES;

import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Literal;
import org.codegraph.shacl.domain.Triple;
import org.codegraph.shacl.exception.RdfParseException;
import org.codegraph.shacl.testutil.ExpectedLogContext;
import org.codegraph.shacl.vocabulary.Xsd;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RdfParsingService.
 */
class RdfParsingServiceTest {

  private final RdfParsingService service = new RdfParsingService();

  @Test
  void parseTurtle_shouldReturnTriples() {
    // Given
    String turtle = PREFIXES + """
        ex:Module1 struct:moduleName "MyApp" ;
                   struct:hasFunction ex:Function1 .
        ex:Function1 struct:arity 2 .
        """;

    // When
    Graph graph = service.parseTurtle(turtle);

    // Then
    assertThat(graph.size()).isEqualTo(3);
    assertThat(graph.contains(Triple.of(MODULE_1, MODULE_NAME, Literal.of("MyApp")))).isTrue();
    assertThat(graph.objects(FUNCTION_1, ARITY))
        .containsExactly(Literal.typed("2", Xsd.INTEGER));
  }

  @Test
  void parseTurtle_shouldReturnEmptyGraph_whenInputIsBlank() {
    assertThat(service.parseTurtle("   ").isEmpty()).isTrue();
    assertThat(service.parseTurtle(null).isEmpty()).isTrue();
  }

  @Test
  void parseTurtle_shouldThrowRdfParseException_whenSyntaxInvalid() {
    try (var ignored = ExpectedLogContext.expect("Undefined prefix")) {
      assertThatThrownBy(() -> service.parseTurtle("ex:a ex:b"))
          .isInstanceOf(RdfParseException.class)
          .hasMessageStartingWith("Invalid RDF syntax")
          .satisfies(e -> assertThat(((RdfParseException) e).getCode())
              .isEqualTo("invalid_rdf"));
    }
  }

  @Test
  void parse_shouldSelectSyntaxFromContentType() {
    // Given
    String ntriples = "<http://example.org/Module1> "
        + "<https://w3id.org/elixir-code/structure#moduleName> \"MyApp\" .\n";

    // When
    Graph graph = service.parse(ntriples, "application/n-triples");

    // Then
    assertThat(graph.contains(Triple.of(MODULE_1, MODULE_NAME, Literal.of("MyApp")))).isTrue();
  }

  @Test
  void parse_shouldRejectUnsupportedContentType() {
    assertThatThrownBy(() -> service.parse("{}", "application/trig"))
        .isInstanceOf(RdfParseException.class)
        .hasMessageContaining("Unsupported RDF content type");
  }
}
