package org.codegraph.shacl.validator;

import static org.codegraph.shacl.validator.ConstraintHelpers.CONSTRAINT_COMPONENT;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.NodeShape;
import org.codegraph.shacl.domain.PropertyShape;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.domain.ValidationResult;
import org.codegraph.shacl.vocabulary.Sh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validates {@code sh:and}, {@code sh:or}, {@code sh:xone} and {@code sh:not}.
 *
 * <p>A referenced shape conforms when its node-level constraints, its property
 * shapes and its own logical constraints yield no results for the focus node.
 * References are resolved in the shape map of the current run; an unknown
 * reference is logged and treated as conforming.</p>
 */
@Component
public class LogicalConstraintValidator {

  private static final Logger logger = LoggerFactory.getLogger(LogicalConstraintValidator.class);

  /** Nesting limit for shape references. */
  public static final int MAX_DEPTH = 50;

  private final List<ConstraintValidator> validators;

  /**
   * Constructs the validator.
   *
   * @param validators the built-in constraint validators used to test referenced shapes
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Validators are Spring-managed stateless beans")
  public LogicalConstraintValidator(List<ConstraintValidator> validators) {
    this.validators = List.copyOf(validators);
  }

  /**
   * Checks the logical constraints of a shape for a focus node.
   *
   * @param graph the data graph
   * @param focusNode the focus node
   * @param shape the shape carrying the logical constraints
   * @param shapes all shapes of the run, by id
   * @return at most one violation per logical operator
   */
  public List<ValidationResult> validateNode(
      Graph graph, Term focusNode, NodeShape shape, Map<Term, NodeShape> shapes) {
    return validateNode(graph, focusNode, shape, shapes, 0);
  }

  private List<ValidationResult> validateNode(
      Graph graph, Term focusNode, NodeShape shape, Map<Term, NodeShape> shapes, int depth) {
    if (!shape.hasLogicalConstraints()) {
      return List.of();
    }
    if (depth > MAX_DEPTH) {
      logger.error("Max recursion depth exceeded validating logical constraints of {}",
          shape.getId());
      return List.of();
    }

    List<ValidationResult> results = new ArrayList<>();

    List<Term> and = shape.getAnd();
    if (!and.isEmpty()) {
      List<Term> failing = and.stream()
          .filter(ref -> !conforms(graph, focusNode, ref, shapes, depth + 1))
          .toList();
      if (!failing.isEmpty()) {
        results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
            "AND constraint failed: not all shapes conform",
            Map.of(CONSTRAINT_COMPONENT, Sh.AND_COMPONENT,
                "failing_shapes", failing,
                "tested_shapes", and.size())));
      }
    }

    List<Term> or = shape.getOr();
    if (!or.isEmpty()
        && or.stream().noneMatch(ref -> conforms(graph, focusNode, ref, shapes, depth + 1))) {
      results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
          "OR constraint failed: no shape conforms",
          Map.of(CONSTRAINT_COMPONENT, Sh.OR_COMPONENT,
              "tested_shapes", or.size())));
    }

    List<Term> xone = shape.getXone();
    if (!xone.isEmpty()) {
      long conforming = xone.stream()
          .filter(ref -> conforms(graph, focusNode, ref, shapes, depth + 1))
          .count();
      if (conforming != 1) {
        results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
            "XONE constraint failed: " + conforming + " shapes conform (expected exactly 1)",
            Map.of(CONSTRAINT_COMPONENT, Sh.XONE_COMPONENT,
                "conforming_count", (int) conforming,
                "tested_shapes", xone.size())));
      }
    }

    Term not = shape.getNot();
    if (not != null && conforms(graph, focusNode, not, shapes, depth + 1)) {
      results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
          "NOT constraint failed: negated shape conforms",
          Map.of(CONSTRAINT_COMPONENT, Sh.NOT_COMPONENT,
              "negated_shape", not)));
    }
    return results;
  }

  private boolean conforms(
      Graph graph, Term focusNode, Term ref, Map<Term, NodeShape> shapes, int depth) {
    NodeShape referenced = shapes.get(ref);
    if (referenced == null) {
      logger.warn("Referenced shape not found: {}", ref);
      return true;
    }
    for (ConstraintValidator validator : validators) {
      if (!validator.validateNode(graph, focusNode, referenced).isEmpty()) {
        return false;
      }
    }
    for (PropertyShape property : referenced.getPropertyShapes()) {
      for (ConstraintValidator validator : validators) {
        if (!validator.validate(graph, focusNode, property).isEmpty()) {
          return false;
        }
      }
    }
    return validateNode(graph, focusNode, referenced, shapes, depth).isEmpty();
  }
}
