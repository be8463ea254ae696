package org.codegraph.shacl.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.codegraph.shacl.config.ShaclValidationProperties;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Iri;
import org.codegraph.shacl.domain.NodeShape;
import org.codegraph.shacl.domain.PropertyShape;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.domain.ValidationReport;
import org.codegraph.shacl.domain.ValidationResult;
import org.codegraph.shacl.exception.ShaclValidationException;
import org.codegraph.shacl.util.JenaTermConverter;
import org.codegraph.shacl.validator.CardinalityValidator;
import org.codegraph.shacl.validator.ConstraintValidator;
import org.codegraph.shacl.validator.LogicalConstraintValidator;
import org.codegraph.shacl.validator.QualifiedValidator;
import org.codegraph.shacl.validator.SparqlConstraintValidator;
import org.codegraph.shacl.validator.StringValidator;
import org.codegraph.shacl.validator.TypeValidator;
import org.codegraph.shacl.validator.ValueValidator;
import org.codegraph.shacl.vocabulary.Rdf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs a validation: selects focus nodes for every node shape and checks each
 * (focus node, shape) pair with all validator families.
 *
 * <p>Per pair, results are concatenated in this order: node-level constraints,
 * property shapes (each through cardinality, type, string, value and qualified
 * checks), logical constraints, SPARQL constraints. The report conforms iff no
 * result has severity VIOLATION.</p>
 *
 * <p>Metrics are recorded for each run:
 * <ul>
 *   <li>{@code shacl.validation.run} - Timer, tagged with the execution mode</li>
 * </ul>
 */
@Service
public class ShapeValidationService {

  private static final Logger logger = LoggerFactory.getLogger(ShapeValidationService.class);

  private final List<ConstraintValidator> nodeValidators;
  private final List<ConstraintValidator> propertyValidators;
  private final LogicalConstraintValidator logicalValidator;
  private final SparqlConstraintValidator sparqlValidator;
  private final ShapesGraphReader shapesGraphReader;
  private final ShaclValidationProperties properties;
  private final MeterRegistry meterRegistry;
  private final Executor executor;

  /**
   * Constructs the validation service.
   *
   * @param cardinalityValidator sh:minCount / sh:maxCount
   * @param typeValidator sh:datatype / sh:class / sh:nodeKind
   * @param stringValidator sh:pattern / length / sh:languageIn
   * @param valueValidator sh:in / sh:hasValue / ranges
   * @param qualifiedValidator qualified value counts
   * @param logicalValidator sh:and / sh:or / sh:xone / sh:not
   * @param sparqlValidator sh:sparql
   * @param shapesGraphReader reader for shapes graphs
   * @param properties validation properties
   * @param meterRegistry metrics registry
   * @param executor executor for parallel runs
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public ShapeValidationService(
      CardinalityValidator cardinalityValidator,
      TypeValidator typeValidator,
      StringValidator stringValidator,
      ValueValidator valueValidator,
      QualifiedValidator qualifiedValidator,
      LogicalConstraintValidator logicalValidator,
      SparqlConstraintValidator sparqlValidator,
      ShapesGraphReader shapesGraphReader,
      ShaclValidationProperties properties,
      MeterRegistry meterRegistry,
      @Qualifier("shaclValidationExecutor") Executor executor) {
    this.nodeValidators = List.of(typeValidator, stringValidator, valueValidator);
    this.propertyValidators = List.of(cardinalityValidator, typeValidator, stringValidator,
        valueValidator, qualifiedValidator);
    this.logicalValidator = logicalValidator;
    this.sparqlValidator = sparqlValidator;
    this.shapesGraphReader = shapesGraphReader;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.executor = executor;
  }

  /**
   * Validates a data graph against the shapes read from a shapes graph.
   *
   * @param dataGraph the data graph
   * @param shapesGraph the shapes graph
   * @return the validation report
   * @throws org.codegraph.shacl.exception.InvalidShapesException if the shapes graph is malformed
   */
  public ValidationReport validate(Graph dataGraph, Graph shapesGraph) {
    return validate(dataGraph, shapesGraphReader.readShapes(shapesGraph));
  }

  /**
   * Validates a data graph against node shapes.
   *
   * @param dataGraph the data graph
   * @param shapes the node shapes; shapes referenced by logical constraints must be included
   * @return the validation report
   * @throws ShaclValidationException if the run is interrupted
   */
  public ValidationReport validate(Graph dataGraph, List<NodeShape> shapes) {
    if (!properties.isEnabled()) {
      logger.warn("SHACL validation is disabled, returning a conforming report");
      return ValidationReport.conforming();
    }

    Timer.Sample sample = Timer.start(meterRegistry);
    Map<Term, NodeShape> shapeMap = new LinkedHashMap<>();
    shapes.forEach(shape -> shapeMap.putIfAbsent(shape.getId(), shape));
    Model model = needsQueries(shapes)
        ? ModelFactory.createModelForGraph(JenaTermConverter.toJenaGraph(dataGraph))
        : null;

    List<ValidationResult> results = properties.isParallel()
        ? validateParallel(dataGraph, model, shapes, shapeMap)
        : validateSequential(dataGraph, model, shapes, shapeMap);

    ValidationReport report = ValidationReport.of(results);
    sample.stop(meterRegistry.timer("shacl.validation.run",
        "mode", properties.isParallel() ? "parallel" : "sequential"));
    logger.debug("Validated {} triples against {} shapes: conforms={}, {} violations, "
            + "{} warnings, {} info",
        dataGraph.size(), shapes.size(), report.conforms(), report.violations().size(),
        report.warnings().size(), report.info().size());
    return report;
  }

  /**
   * Validates one focus node against one shape. Logical constraints can only
   * reference the shape itself.
   *
   * @param dataGraph the data graph
   * @param focusNode the focus node
   * @param shape the node shape
   * @return results in check order
   */
  public List<ValidationResult> validateFocusNode(Graph dataGraph, Term focusNode,
      NodeShape shape) {
    Model model = needsQueries(List.of(shape))
        ? ModelFactory.createModelForGraph(JenaTermConverter.toJenaGraph(dataGraph))
        : null;
    return validateFocusNode(dataGraph, model, focusNode, shape, Map.of(shape.getId(), shape));
  }

  /**
   * Selects the focus nodes of a shape: its target nodes, the instances of its
   * target classes and, for an implicit class target, the instances of the shape itself.
   *
   * @param dataGraph the data graph
   * @param shape the node shape
   * @return distinct focus nodes in discovery order
   */
  public List<Term> focusNodes(Graph dataGraph, NodeShape shape) {
    Set<Term> focusNodes = new LinkedHashSet<>(shape.getTargetNodes());
    for (Iri targetClass : shape.getTargetClasses()) {
      focusNodes.addAll(dataGraph.subjects(Rdf.TYPE, targetClass));
    }
    if (shape.isImplicitClassTarget()) {
      focusNodes.addAll(dataGraph.subjects(Rdf.TYPE, shape.getId()));
    }
    return new ArrayList<>(focusNodes);
  }

  private List<ValidationResult> validateSequential(Graph dataGraph, Model model,
      List<NodeShape> shapes, Map<Term, NodeShape> shapeMap) {
    List<ValidationResult> results = new ArrayList<>();
    for (NodeShape shape : shapes) {
      results.addAll(validateShape(dataGraph, model, shape, shapeMap));
    }
    return results;
  }

  /**
   * Fans the shapes out to the executor and collects their results in shape order.
   *
   * <p>A shape the executor rejects is validated on the calling thread. A shape
   * that exceeds the shape timeout is abandoned, not stopped: cancelling a
   * {@link CompletableFuture} does not interrupt its task, so the worker stays
   * busy until the task ends, bounded by the per-query timeout of its SPARQL
   * constraints. Cancelling does keep a task that has not started yet from running.</p>
   */
  private List<ValidationResult> validateParallel(Graph dataGraph, Model model,
      List<NodeShape> shapes, Map<Term, NodeShape> shapeMap) {
    List<CompletableFuture<List<ValidationResult>>> futures = new ArrayList<>();
    for (NodeShape shape : shapes) {
      Supplier<List<ValidationResult>> task =
          () -> validateShape(dataGraph, model, shape, shapeMap);
      try {
        futures.add(CompletableFuture.supplyAsync(task, executor));
      } catch (RejectedExecutionException e) {
        logger.debug("Executor rejected shape {}, validating it inline", shape.getId());
        futures.add(CompletableFuture.supplyAsync(task, Runnable::run));
      }
    }

    List<ValidationResult> results = new ArrayList<>();
    for (int i = 0; i < futures.size(); i++) {
      CompletableFuture<List<ValidationResult>> future = futures.get(i);
      Term shapeId = shapes.get(i).getId();
      try {
        results.addAll(future.get(properties.getShapeTimeout(), TimeUnit.MILLISECONDS));
      } catch (TimeoutException e) {
        future.cancel(true);
        logger.warn("Validation of shape {} timed out after {} ms, skipping its results",
            shapeId, properties.getShapeTimeout());
      } catch (ExecutionException e) {
        logger.warn("Validation of shape {} failed, skipping its results", shapeId,
            e.getCause());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        futures.forEach(f -> f.cancel(true));
        throw new ShaclValidationException("Validation run interrupted", e);
      }
    }
    return results;
  }

  private List<ValidationResult> validateShape(Graph dataGraph, Model model, NodeShape shape,
      Map<Term, NodeShape> shapeMap) {
    List<ValidationResult> results = new ArrayList<>();
    for (Term focusNode : focusNodes(dataGraph, shape)) {
      results.addAll(validateFocusNode(dataGraph, model, focusNode, shape, shapeMap));
    }
    return results;
  }

  private List<ValidationResult> validateFocusNode(Graph dataGraph, Model model, Term focusNode,
      NodeShape shape, Map<Term, NodeShape> shapeMap) {
    List<ValidationResult> results = new ArrayList<>();
    for (ConstraintValidator validator : nodeValidators) {
      results.addAll(validator.validateNode(dataGraph, focusNode, shape));
    }
    for (PropertyShape property : shape.getPropertyShapes()) {
      for (ConstraintValidator validator : propertyValidators) {
        results.addAll(validator.validate(dataGraph, focusNode, property));
      }
    }
    results.addAll(logicalValidator.validateNode(dataGraph, focusNode, shape, shapeMap));
    if (model != null) {
      results.addAll(sparqlValidator.validate(model, focusNode, shape.getSparqlConstraints()));
    }
    return results;
  }

  private static boolean needsQueries(List<NodeShape> shapes) {
    return shapes.stream().anyMatch(shape -> !shape.getSparqlConstraints().isEmpty());
  }
}
