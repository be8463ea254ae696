package org.codegraph.shacl.validator;

import static org.codegraph.shacl.validator.ConstraintHelpers.ACTUAL_VALUE;
import static org.codegraph.shacl.validator.ConstraintHelpers.CONSTRAINT_COMPONENT;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Iri;
import org.codegraph.shacl.domain.NodeShape;
import org.codegraph.shacl.domain.PropertyShape;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.domain.ValidationResult;
import org.codegraph.shacl.vocabulary.Sh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validates {@code sh:in}, {@code sh:hasValue} and the four numeric range
 * constraints.
 *
 * <p>Range checks skip values that are not numeric literals. Node-level bounds
 * are literals and are unwrapped first; a bound that is not a number disables
 * that check.</p>
 */
@Component
public class ValueValidator implements ConstraintValidator {

  private static final Logger logger = LoggerFactory.getLogger(ValueValidator.class);

  /**
   * Comparison performed by one range constraint.
   */
  private enum Bound {
    MIN_INCLUSIVE("min_inclusive", Sh.MIN_INCLUSIVE_COMPONENT, ">="),
    MAX_INCLUSIVE("max_inclusive", Sh.MAX_INCLUSIVE_COMPONENT, "<="),
    MIN_EXCLUSIVE("min_exclusive", Sh.MIN_EXCLUSIVE_COMPONENT, ">"),
    MAX_EXCLUSIVE("max_exclusive", Sh.MAX_EXCLUSIVE_COMPONENT, "<");

    private final String detailKey;
    private final Iri component;
    private final String operator;

    Bound(String detailKey, Iri component, String operator) {
      this.detailKey = detailKey;
      this.component = component;
      this.operator = operator;
    }

    boolean accepts(BigDecimal value, BigDecimal limit) {
      int cmp = value.compareTo(limit);
      return switch (this) {
        case MIN_INCLUSIVE -> cmp >= 0;
        case MAX_INCLUSIVE -> cmp <= 0;
        case MIN_EXCLUSIVE -> cmp > 0;
        case MAX_EXCLUSIVE -> cmp < 0;
      };
    }

    String message(String subject, BigDecimal limit, BigDecimal actual) {
      String prefix = switch (this) {
        case MIN_INCLUSIVE, MIN_EXCLUSIVE -> " is below minimum";
        case MAX_INCLUSIVE, MAX_EXCLUSIVE -> " exceeds maximum";
      };
      return subject + prefix + " (expected " + operator + " " + limit.toPlainString()
          + ", found " + actual.toPlainString() + ")";
    }
  }

  @Override
  public List<ValidationResult> validate(Graph graph, Term focusNode, PropertyShape shape) {
    List<Term> values = ConstraintHelpers.getPropertyValues(graph, focusNode, shape.getPath());
    List<ValidationResult> results = new ArrayList<>();

    List<Term> allowed = shape.getIn();
    if (!allowed.isEmpty()) {
      for (Term value : values) {
        if (!allowed.contains(value)) {
          results.add(ConstraintHelpers.buildViolation(focusNode, shape, value,
              "Value is not one of the allowed values",
              Map.of(CONSTRAINT_COMPONENT, Sh.IN_COMPONENT,
                  "allowed_values", allowed,
                  ACTUAL_VALUE, value)));
        }
      }
    }

    Term required = shape.getHasValue();
    if (required != null && !values.contains(required)) {
      results.add(ConstraintHelpers.buildViolation(focusNode, shape, null,
          "Required value is missing",
          Map.of(CONSTRAINT_COMPONENT, Sh.HAS_VALUE_COMPONENT,
              "required_value", required)));
    }

    checkRange(results, values, Bound.MIN_INCLUSIVE, shape.getMinInclusive(), focusNode, shape);
    checkRange(results, values, Bound.MAX_INCLUSIVE, shape.getMaxInclusive(), focusNode, shape);
    checkRange(results, values, Bound.MIN_EXCLUSIVE, shape.getMinExclusive(), focusNode, shape);
    checkRange(results, values, Bound.MAX_EXCLUSIVE, shape.getMaxExclusive(), focusNode, shape);
    return results;
  }

  private void checkRange(List<ValidationResult> results, List<Term> values, Bound bound,
      BigDecimal limit, Term focusNode, PropertyShape shape) {
    if (limit == null) {
      return;
    }
    for (Term value : values) {
      Optional<BigDecimal> number = ConstraintHelpers.extractNumber(value);
      if (number.isPresent() && !bound.accepts(number.get(), limit)) {
        results.add(ConstraintHelpers.buildViolation(focusNode, shape, value,
            bound.message("Value", limit, number.get()),
            Map.of(CONSTRAINT_COMPONENT, bound.component,
                bound.detailKey, limit,
                ACTUAL_VALUE, number.get())));
      }
    }
  }

  @Override
  public List<ValidationResult> validateNode(Graph graph, Term focusNode, NodeShape shape) {
    List<ValidationResult> results = new ArrayList<>();

    List<Term> allowed = shape.getIn();
    if (!allowed.isEmpty() && !allowed.contains(focusNode)) {
      results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
          "Focus node is not one of the allowed values",
          Map.of(CONSTRAINT_COMPONENT, Sh.IN_COMPONENT,
              "allowed_values", allowed,
              ACTUAL_VALUE, focusNode)));
    }

    Term required = shape.getHasValue();
    if (required != null && !required.equals(focusNode)) {
      results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
          "Focus node is not the required value",
          Map.of(CONSTRAINT_COMPONENT, Sh.HAS_VALUE_COMPONENT,
              "required_value", required,
              ACTUAL_VALUE, focusNode)));
    }

    checkNodeRange(results, Bound.MIN_INCLUSIVE, shape.getMinInclusive(), focusNode, shape);
    checkNodeRange(results, Bound.MAX_INCLUSIVE, shape.getMaxInclusive(), focusNode, shape);
    checkNodeRange(results, Bound.MIN_EXCLUSIVE, shape.getMinExclusive(), focusNode, shape);
    checkNodeRange(results, Bound.MAX_EXCLUSIVE, shape.getMaxExclusive(), focusNode, shape);
    return results;
  }

  private void checkNodeRange(List<ValidationResult> results, Bound bound, Term boundTerm,
      Term focusNode, NodeShape shape) {
    if (boundTerm == null) {
      return;
    }
    Optional<BigDecimal> limit = ConstraintHelpers.extractNumber(boundTerm);
    if (limit.isEmpty()) {
      logger.warn("Ignoring non-numeric {} bound {} on shape {}",
          bound.detailKey, boundTerm, shape.getId());
      return;
    }
    Optional<BigDecimal> number = ConstraintHelpers.extractNumber(focusNode);
    if (number.isPresent() && !bound.accepts(number.get(), limit.get())) {
      results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
          bound.message("Focus node", limit.get(), number.get()),
          Map.of(CONSTRAINT_COMPONENT, bound.component,
              bound.detailKey, limit.get(),
              ACTUAL_VALUE, number.get())));
    }
  }
}
