package org.codegraph.shacl.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Iri;
import org.codegraph.shacl.domain.Literal;
import org.codegraph.shacl.domain.Severity;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.domain.Triple;
import org.codegraph.shacl.domain.ValidationReport;
import org.codegraph.shacl.domain.ValidationResult;
import org.codegraph.shacl.exception.RdfParseException;
import org.codegraph.shacl.exception.ReportParseException;
import org.codegraph.shacl.vocabulary.Sh;
import org.codegraph.shacl.vocabulary.Xsd;
import org.springframework.stereotype.Service;

/**
 * Service for reading serialized validation reports back into
 * {@link ValidationReport}s.
 *
 * <p>Unlike query failures during validation, a malformed report is always an
 * error: a missing report node or an unreadable {@code sh:conforms} value raises
 * {@link ReportParseException}. Unknown severities fall back to
 * {@link Severity#VIOLATION}.</p>
 */
@Service
public class ReportParsingService {

  private final RdfParsingService rdfParsingService;

  /**
   * Constructs the parser.
   *
   * @param rdfParsingService service used to parse the report text
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RdfParsingService is a Spring-managed bean")
  public ReportParsingService(RdfParsingService rdfParsingService) {
    this.rdfParsingService = rdfParsingService;
  }

  /**
   * Parses a Turtle validation report.
   *
   * @param text the Turtle text
   * @return the report
   * @throws ReportParseException if the text does not parse or holds no valid report
   */
  public ValidationReport parse(String text) {
    Graph graph;
    try {
      graph = rdfParsingService.parseTurtle(text);
    } catch (RdfParseException e) {
      throw new ReportParseException("Failed to parse validation report: " + e.getMessage(), e);
    }
    return parse(graph);
  }

  /**
   * Reads a validation report from a graph. The first subject carrying
   * {@code sh:conforms} is the report node.
   *
   * @param graph the report graph
   * @return the report
   * @throws ReportParseException if no report node exists or its conforms value is invalid
   */
  public ValidationReport parse(Graph graph) {
    List<Triple> conformsTriples = graph.triplesWith(null, Sh.CONFORMS);
    if (conformsTriples.isEmpty()) {
      throw new ReportParseException("No validation report found");
    }
    Triple conformsTriple = conformsTriples.get(0);
    Term reportNode = conformsTriple.subject();
    boolean conforms = parseConforms(conformsTriple.object());

    List<ValidationResult> violations = new ArrayList<>();
    List<ValidationResult> warnings = new ArrayList<>();
    List<ValidationResult> info = new ArrayList<>();
    for (Term resultNode : graph.objects(reportNode, Sh.RESULT)) {
      ValidationResult result = parseResult(graph, resultNode);
      switch (result.severity()) {
        case VIOLATION -> violations.add(result);
        case WARNING -> warnings.add(result);
        case INFO -> info.add(result);
        default -> throw new IllegalStateException("Unknown severity: " + result.severity());
      }
    }
    return new ValidationReport(conforms, violations, warnings, info);
  }

  private static boolean parseConforms(Term value) {
    if (value instanceof Literal literal) {
      String lexical = literal.lexical().trim().toLowerCase(Locale.ROOT);
      boolean nativeBoolean = Xsd.BOOLEAN.equals(literal.datatype());
      if ("true".equals(lexical) || nativeBoolean && "1".equals(lexical)) {
        return true;
      }
      if ("false".equals(lexical) || nativeBoolean && "0".equals(lexical)) {
        return false;
      }
    }
    throw new ReportParseException("Invalid sh:conforms value: " + value);
  }

  private static ValidationResult parseResult(Graph graph, Term resultNode) {
    Term focusNode = single(graph, resultNode, Sh.FOCUS_NODE);
    if (focusNode == null) {
      throw new ReportParseException("Validation result " + resultNode + " has no sh:focusNode");
    }
    Term message = single(graph, resultNode, Sh.RESULT_MESSAGE);
    return ValidationResult.builder(focusNode)
        .resultPath(single(graph, resultNode, Sh.RESULT_PATH) instanceof Iri path ? path : null)
        .value(single(graph, resultNode, Sh.VALUE))
        .message(message instanceof Literal literal ? literal.lexical() : "")
        .severity(Severity.fromIri(single(graph, resultNode, Sh.RESULT_SEVERITY)))
        .sourceShape(single(graph, resultNode, Sh.SOURCE_SHAPE))
        .constraintComponent(
            single(graph, resultNode, Sh.SOURCE_CONSTRAINT_COMPONENT) instanceof Iri component
                ? component : null)
        .build();
  }

  private static Term single(Graph graph, Term subject, Iri predicate) {
    List<Term> values = graph.objects(subject, predicate);
    return values.isEmpty() ? null : values.get(0);
  }
}
