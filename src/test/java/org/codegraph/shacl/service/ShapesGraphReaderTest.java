package org.codegraph.shacl.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.codegraph.shacl.testutil.TestConstants.CORE;
import static org.codegraph.shacl.testutil.TestConstants.FUNCTION;
import static org.codegraph.shacl.testutil.TestConstants.FUNCTION_CLAUSE;
import static org.codegraph.shacl.testutil.TestConstants.FUNCTION_SHAPE;
import static org.codegraph.shacl.testutil.TestConstants.HAS_CLAUSE;
import static org.codegraph.shacl.testutil.TestConstants.MODULE;
import static org.codegraph.shacl.testutil.TestConstants.MODULE_1;
import static org.codegraph.shacl.testutil.TestConstants.MODULE_NAME;
import static org.codegraph.shacl.testutil.TestConstants.MODULE_SHAPE;
import static org.codegraph.shacl.testutil.TestConstants.PREFIXES;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;
import org.codegraph.shacl.domain.BlankNode;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Iri;
import org.codegraph.shacl.domain.Literal;
import org.codegraph.shacl.domain.NodeKind;
import org.codegraph.shacl.domain.NodeShape;
import org.codegraph.shacl.domain.PropertyShape;
import org.codegraph.shacl.domain.SparqlConstraint;
import org.codegraph.shacl.exception.InvalidShapesException;
import org.codegraph.shacl.vocabulary.Rdf;
import org.codegraph.shacl.vocabulary.Xsd;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ShapesGraphReader.
 */
class ShapesGraphReaderTest {

  private final RdfParsingService rdfParsingService = new RdfParsingService();
  private final ShapesGraphReader reader = new ShapesGraphReader();

  private List<NodeShape> read(String turtle) {
    return reader.readShapes(rdfParsingService.parseTurtle(PREFIXES + turtle));
  }

  @Test
  void readShapes_shouldReadTargetsAndPropertyShapes() {
    // When
    List<NodeShape> shapes = read("""
        ex:ModuleShape a sh:NodeShape ;
          sh:targetClass struct:Module ;
          sh:targetNode ex:Module1 ;
          sh:property [
            sh:path struct:moduleName ;
            sh:minCount 1 ;
            sh:maxCount 1 ;
            sh:datatype xsd:string ;
            sh:pattern "^elixir" ;
            sh:flags "i" ;
            sh:maxInclusive 255 ;
            sh:message "Module name is required"
          ] .
        """);

    // Then
    assertThat(shapes).singleElement().satisfies(shape -> {
      assertThat(shape.getId()).isEqualTo(MODULE_SHAPE);
      assertThat(shape.getTargetClasses()).containsExactly(MODULE);
      assertThat(shape.getTargetNodes()).containsExactly(MODULE_1);
      assertThat(shape.getPropertyShapes()).singleElement().satisfies(property -> {
        assertThat(property.getId()).isInstanceOf(BlankNode.class);
        assertThat(property.getPath()).isEqualTo(MODULE_NAME);
        assertThat(property.getMinCount()).isEqualTo(1);
        assertThat(property.getMaxCount()).isEqualTo(1);
        assertThat(property.getDatatype()).isEqualTo(Xsd.STRING);
        assertThat(property.getMaxInclusive()).isEqualByComparingTo(new BigDecimal("255"));
        assertThat(property.getMessage()).isEqualTo("Module name is required");
        assertThat(property.getPattern().flags() & Pattern.CASE_INSENSITIVE).isNotZero();
        assertThat(property.getPattern().matcher("ElixirApp").find()).isTrue();
      });
    });
  }

  @Test
  void readShapes_shouldReadNodeLevelConstraints() {
    // When
    List<NodeShape> shapes = read("""
        ex:FunctionShape a sh:NodeShape ;
          sh:nodeKind sh:IRI ;
          sh:class struct:Function ;
          sh:languageIn ( "en" "de" ) ;
          sh:in ( ex:a ex:b ) ;
          sh:minInclusive 1 .
        """);

    // Then
    assertThat(shapes).singleElement().satisfies(shape -> {
      assertThat(shape.getNodeKind()).isEqualTo(NodeKind.IRI);
      assertThat(shape.getClassIri()).isEqualTo(FUNCTION);
      assertThat(shape.getLanguageIn()).containsExactly("en", "de");
      assertThat(shape.getIn()).containsExactly(
          Iri.of("http://example.org/a"), Iri.of("http://example.org/b"));
      assertThat(shape.getMinInclusive()).isEqualTo(Literal.typed("1", Xsd.INTEGER));
    });
  }

  @Test
  void readShapes_shouldFollowLogicalReferences() {
    // When
    List<NodeShape> shapes = read("""
        ex:FunctionShape sh:targetClass struct:Function ;
          sh:or ( ex:HasName ex:IsAnonymous ) ;
          sh:not ex:IsMacro .
        ex:HasName sh:property [ sh:path struct:functionName ; sh:minCount 1 ] .
        ex:IsAnonymous sh:and ( ex:HasName ) .
        ex:IsMacro sh:class ex:Macro .
        """);

    // Then
    assertThat(shapes).extracting(NodeShape::getId).containsExactly(
        FUNCTION_SHAPE,
        Iri.of("http://example.org/HasName"),
        Iri.of("http://example.org/IsAnonymous"),
        Iri.of("http://example.org/IsMacro"));
    assertThat(shapes.get(0).getOr()).hasSize(2);
    assertThat(shapes.get(2).getAnd()).containsExactly(Iri.of("http://example.org/HasName"));
  }

  @Test
  void readShapes_shouldMarkImplicitClassTarget() {
    List<NodeShape> shapes = read("struct:Function a rdfs:Class , sh:NodeShape .");

    assertThat(shapes).singleElement()
        .satisfies(shape -> assertThat(shape.isImplicitClassTarget()).isTrue());
  }

  @Test
  void readShapes_shouldReadQualifiedValueShape() {
    // When
    List<NodeShape> shapes = read("""
        ex:FunctionShape a sh:NodeShape ;
          sh:property [
            sh:path struct:hasClause ;
            sh:qualifiedValueShape [ sh:class struct:FunctionClause ] ;
            sh:qualifiedMinCount 1
          ] .
        """);

    // Then
    PropertyShape property = shapes.get(0).getPropertyShapes().get(0);
    assertThat(property.getPath()).isEqualTo(HAS_CLAUSE);
    assertThat(property.getQualifiedClass()).isEqualTo(FUNCTION_CLAUSE);
    assertThat(property.getQualifiedMinCount()).isEqualTo(1);
  }

  @Test
  void readShapes_shouldReadSparqlConstraintWithPrefixes() {
    // When
    List<NodeShape> shapes = read("""
        ex:FunctionShape a sh:NodeShape ;
          sh:sparql [
            sh:message "End line precedes start line" ;
            sh:prefixes ex:Prefixes ;
            sh:select "SELECT $this WHERE { $this core:endLine ?e }"
          ] .
        ex:Prefixes sh:declare [ sh:prefix "core" ; sh:namespace "https://w3id.org/elixir-code/core#"^^xsd:anyURI ] .
        """);

    // Then
    SparqlConstraint constraint = shapes.get(0).getSparqlConstraints().get(0);
    assertThat(constraint.sourceShape()).isEqualTo(FUNCTION_SHAPE);
    assertThat(constraint.message()).isEqualTo("End line precedes start line");
    assertThat(constraint.selectQuery()).startsWith("SELECT $this");
    assertThat(constraint.prefixes()).containsEntry("core", CORE);
  }

  @Test
  void readShapes_shouldRejectPropertyShapeWithoutPath() {
    assertThatThrownBy(() -> read("ex:S a sh:NodeShape ; sh:property [ sh:minCount 1 ] ."))
        .isInstanceOf(InvalidShapesException.class)
        .hasMessageContaining("has no sh:path");
  }

  @Test
  void readShapes_shouldRejectInvalidRegex() {
    assertThatThrownBy(() -> read("""
        ex:S a sh:NodeShape ;
          sh:property [ sh:path struct:moduleName ; sh:pattern "([a-z" ] .
        """))
        .isInstanceOf(InvalidShapesException.class)
        .hasMessageContaining("Invalid sh:pattern");
  }

  @Test
  void readShapes_shouldRejectNonIntegerCount() {
    assertThatThrownBy(() -> read("""
        ex:S a sh:NodeShape ;
          sh:property [ sh:path struct:moduleName ; sh:minCount 1.5 ] .
        """))
        .isInstanceOf(InvalidShapesException.class)
        .hasMessageContaining("must be an integer");
  }

  @Test
  void readShapes_shouldRejectSparqlConstraintWithoutSelect() {
    assertThatThrownBy(() -> read("ex:S a sh:NodeShape ; sh:sparql [ sh:message \"m\" ] ."))
        .isInstanceOf(InvalidShapesException.class)
        .hasMessageContaining("has no sh:select");
  }

  @Test
  void readList_shouldDetectCycles() {
    // Given
    BlankNode cell = BlankNode.of("c");
    Graph graph = Graph.builder()
        .add(cell, Rdf.FIRST, Literal.of("x"))
        .add(cell, Rdf.REST, cell)
        .build();

    // When / Then
    assertThatThrownBy(() -> ShapesGraphReader.readList(graph, cell))
        .isInstanceOf(InvalidShapesException.class)
        .hasMessageStartingWith("Cyclic RDF list");
  }

  @Test
  void readShapes_shouldReturnEmpty_whenGraphHasNoShapes() {
    assertThat(reader.readShapes(Graph.empty())).isEmpty();
  }
}
