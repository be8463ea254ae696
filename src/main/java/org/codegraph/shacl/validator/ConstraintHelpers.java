package org.codegraph.shacl.validator;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Iri;
import org.codegraph.shacl.domain.Literal;
import org.codegraph.shacl.domain.NodeKind;
import org.codegraph.shacl.domain.NodeShape;
import org.codegraph.shacl.domain.PropertyShape;
import org.codegraph.shacl.domain.Severity;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.domain.ValidationResult;
import org.codegraph.shacl.vocabulary.Rdf;
import org.codegraph.shacl.vocabulary.Xsd;

/**
 * Predicates and builders shared by the constraint validators.
 *
 * <p>The extractors are lenient: a value of the wrong kind yields an empty
 * result and the calling check skips it. Reporting wrong kinds is left to the
 * datatype and node kind checks.</p>
 */
public final class ConstraintHelpers {

  /** Detail key naming the constraint component of a result. */
  public static final String CONSTRAINT_COMPONENT = "constraint_component";

  /** Detail key for the offending value. */
  public static final String ACTUAL_VALUE = "actual_value";

  private ConstraintHelpers() {
    // Utility class - prevent instantiation
  }

  /**
   * Gets all objects of {@code (focusNode, path, ?)}.
   *
   * @param graph the data graph
   * @param focusNode the focus node
   * @param path the predicate
   * @return the values in graph order
   */
  public static List<Term> getPropertyValues(Graph graph, Term focusNode, Iri path) {
    return graph.objects(focusNode, path);
  }

  /**
   * Checks for a direct {@code rdf:type} assertion. Subclasses are not followed.
   *
   * @param graph the data graph
   * @param node the node
   * @param classIri the class
   * @return true iff {@code (node, rdf:type, classIri)} is in the graph
   */
  public static boolean isInstanceOf(Graph graph, Term node, Iri classIri) {
    if (node instanceof Literal) {
      return false;
    }
    return graph.objects(node, Rdf.TYPE).contains(classIri);
  }

  public static boolean isDatatype(Term term, Iri datatype) {
    return term instanceof Literal literal && literal.datatype().equals(datatype);
  }

  public static boolean isNodeKind(Term term, NodeKind kind) {
    return kind.matches(term);
  }

  /**
   * Gets the lexical form of a literal.
   *
   * @param term the term
   * @return the lexical form, or empty for IRIs and blank nodes
   */
  public static Optional<String> extractString(Term term) {
    if (term instanceof Literal literal) {
      return Optional.of(literal.lexical());
    }
    return Optional.empty();
  }

  /**
   * Gets the numeric value of a literal with a numeric XSD datatype.
   *
   * @param term the term
   * @return the value, or empty if the term is not a numeric literal or does not parse
   */
  public static Optional<BigDecimal> extractNumber(Term term) {
    if (!(term instanceof Literal literal) || !Xsd.NUMERIC_TYPES.contains(literal.datatype())) {
      return Optional.empty();
    }
    String lexical = literal.lexical().trim();
    if (lexical.startsWith("+")) {
      lexical = lexical.substring(1);
    }
    try {
      return Optional.of(new BigDecimal(lexical));
    } catch (NumberFormatException e) {
      // INF, NaN and malformed lexical forms
      return Optional.empty();
    }
  }

  /**
   * Counts Unicode code points.
   *
   * @param value the string
   * @return the length in code points
   */
  public static int length(String value) {
    return value.codePointCount(0, value.length());
  }

  /**
   * Builds a property-level violation.
   *
   * @param focusNode the focus node
   * @param shape the property shape
   * @param value the offending value, or null
   * @param defaultMessage the message used when the shape has none
   * @param details diagnostics; a {@code constraint_component} IRI is also copied
   *     into the result
   * @return a new violation
   */
  public static ValidationResult buildViolation(Term focusNode, PropertyShape shape, Term value,
      String defaultMessage, Map<String, Object> details) {
    return build(focusNode, shape.getPath(), value, shape.getId(),
        shape.getMessage() != null ? shape.getMessage() : defaultMessage, details);
  }

  /**
   * Builds a node-level violation. The focus node is the result value.
   *
   * @param focusNode the focus node
   * @param shape the node shape
   * @param defaultMessage the message used when the shape has none
   * @param details diagnostics
   * @return a new violation
   */
  public static ValidationResult buildNodeViolation(
      Term focusNode, NodeShape shape, String defaultMessage, Map<String, Object> details) {
    return build(focusNode, null, focusNode, shape.getId(),
        shape.getMessage() != null ? shape.getMessage() : defaultMessage, details);
  }

  private static ValidationResult build(Term focusNode, Iri path, Term value, Term sourceShape,
      String message, Map<String, Object> details) {
    ValidationResult.Builder builder = ValidationResult.builder(focusNode)
        .resultPath(path)
        .value(value)
        .sourceShape(sourceShape)
        .message(message)
        .severity(Severity.VIOLATION)
        .details(details);
    if (details.get(CONSTRAINT_COMPONENT) instanceof Iri component) {
      builder.constraintComponent(component);
    }
    return builder.build();
  }
}
