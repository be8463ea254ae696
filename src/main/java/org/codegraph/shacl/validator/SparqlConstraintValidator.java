package org.codegraph.shacl.validator;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.shared.JenaException;
import org.codegraph.shacl.config.ShaclValidationProperties;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Iri;
import org.codegraph.shacl.domain.Literal;
import org.codegraph.shacl.domain.SparqlConstraint;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.domain.ValidationResult;
import org.codegraph.shacl.util.JenaTermConverter;
import org.codegraph.shacl.util.SubstitutionMode;
import org.codegraph.shacl.util.ThisSubstitution;
import org.codegraph.shacl.vocabulary.Sh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates query-based constraints ({@code sh:sparql}) for a focus node.
 *
 * <p>Each constraint's SELECT query is bound to the focus node, run against the
 * data graph with the configured timeout, and every returned row becomes one
 * violation whose details are the row's bindings. A query that fails to parse,
 * fails to execute, times out or binds a node the term model cannot represent
 * (a quoted triple, a {@code rdf:langString} without a tag) is logged and
 * contributes no violations, so one broken rule does not stop the run.</p>
 *
 * <p>Metrics:
 * <ul>
 *   <li>{@code shacl.sparql.executions} - Counter</li>
 *   <li>{@code shacl.sparql.failures} - Counter, tagged with the failure type
 *       ({@code parse}, {@code not_select}, {@code execution}, {@code mapping})</li>
 * </ul>
 */
@Component
public class SparqlConstraintValidator {

  private static final Logger logger = LoggerFactory.getLogger(SparqlConstraintValidator.class);

  /** Row binding promoted to the result value. */
  private static final String VALUE_VARIABLE = "value";

  /** Row binding promoted to the result path. */
  private static final String PATH_VARIABLE = "path";

  private final ShaclValidationProperties properties;
  private final MeterRegistry meterRegistry;

  /**
   * Constructs the validator.
   *
   * @param properties validation properties (timeout, substitution mode)
   * @param meterRegistry metrics registry
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public SparqlConstraintValidator(
      ShaclValidationProperties properties,
      MeterRegistry meterRegistry) {
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Evaluates constraints against a graph.
   *
   * @param graph the data graph
   * @param focusNode the focus node
   * @param constraints the constraints to evaluate
   * @return one violation per result row, constraints in order
   */
  public List<ValidationResult> validate(
      Graph graph, Term focusNode, List<SparqlConstraint> constraints) {
    if (constraints.isEmpty()) {
      return List.of();
    }
    Model model = ModelFactory.createModelForGraph(JenaTermConverter.toJenaGraph(graph));
    return validate(model, focusNode, constraints);
  }

  /**
   * Evaluates constraints against a Jena model that holds the data graph.
   * Callers validating many focus nodes convert the graph once and use this overload.
   *
   * @param model the data graph as a Jena model
   * @param focusNode the focus node
   * @param constraints the constraints to evaluate
   * @return one violation per result row, constraints in order
   */
  public List<ValidationResult> validate(
      Model model, Term focusNode, List<SparqlConstraint> constraints) {
    if (constraints.isEmpty()) {
      return List.of();
    }
    if (focusNode instanceof Literal) {
      logger.warn("Skipping {} SPARQL constraint(s): literal focus node {} cannot bind $this",
          constraints.size(), focusNode);
      return List.of();
    }

    List<ValidationResult> results = new ArrayList<>();
    for (SparqlConstraint constraint : constraints) {
      results.addAll(evaluate(model, focusNode, constraint));
    }
    return results;
  }

  private List<ValidationResult> evaluate(
      Model model, Term focusNode, SparqlConstraint constraint) {
    meterRegistry.counter("shacl.sparql.executions").increment();

    Query query;
    try {
      query = prepare(constraint, focusNode);
    } catch (JenaException e) {
      return failed("parse", constraint, focusNode, e);
    }
    if (!query.isSelectType()) {
      logger.warn("SPARQL constraint of shape {} is not a SELECT query, skipping",
          constraint.sourceShape());
      meterRegistry.counter("shacl.sparql.failures", "type", "not_select").increment();
      return List.of();
    }

    List<ValidationResult> results = new ArrayList<>();
    try (QueryExecution qexec = QueryExecution.create()
        .query(query)
        .model(model)
        .timeout(properties.getQueryTimeout(), TimeUnit.MILLISECONDS)
        .build()) {
      ResultSet rows = qexec.execSelect();
      while (rows.hasNext()) {
        QuerySolution row = rows.next();
        try {
          results.add(toViolation(row, focusNode, constraint));
        } catch (IllegalArgumentException e) {
          // Row bound something outside the term model, e.g. a quoted triple
          return failed("mapping", constraint, focusNode, e);
        }
      }
    } catch (JenaException e) {
      return failed("execution", constraint, focusNode, e);
    }
    return results;
  }

  private Query prepare(SparqlConstraint constraint, Term focusNode) {
    String template = ThisSubstitution.withPrefixes(
        constraint.selectQuery(), constraint.prefixes());
    if (properties.getSubstitutionMode() == SubstitutionMode.ALGEBRAIC) {
      return ThisSubstitution.bind(template, focusNode);
    }
    return QueryFactory.create(ThisSubstitution.substitute(template, focusNode));
  }

  private List<ValidationResult> failed(
      String type, SparqlConstraint constraint, Term focusNode, RuntimeException e) {
    logger.warn("SPARQL constraint of shape {} failed ({}) for focus node {}: {}",
        constraint.sourceShape(), type, focusNode, e.getMessage());
    meterRegistry.counter("shacl.sparql.failures", "type", type).increment();
    return List.of();
  }

  private ValidationResult toViolation(
      QuerySolution row, Term focusNode, SparqlConstraint constraint) {
    Map<String, Object> details = new LinkedHashMap<>();
    Iterator<String> names = row.varNames();
    while (names.hasNext()) {
      String name = names.next();
      RDFNode bound = row.get(name);
      if (bound != null) {
        details.put(name, JenaTermConverter.toTerm(bound.asNode()));
      }
    }

    ValidationResult.Builder builder = ValidationResult.builder(focusNode)
        .sourceShape(constraint.sourceShape())
        .message(constraint.message())
        .constraintComponent(Sh.SPARQL_COMPONENT)
        .details(details);
    if (details.get(VALUE_VARIABLE) instanceof Term value) {
      builder.value(value);
    }
    if (details.get(PATH_VARIABLE) instanceof Iri path) {
      builder.resultPath(path);
    }
    return builder.build();
  }
}
