package org.codegraph.shacl.validator;

import static org.codegraph.shacl.validator.ConstraintHelpers.CONSTRAINT_COMPONENT;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.PropertyShape;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.domain.ValidationResult;
import org.codegraph.shacl.vocabulary.Sh;
import org.springframework.stereotype.Component;

/**
 * Validates {@code sh:minCount} and {@code sh:maxCount}.
 */
@Component
public class CardinalityValidator implements ConstraintValidator {

  @Override
  public List<ValidationResult> validate(Graph graph, Term focusNode, PropertyShape shape) {
    Integer minCount = shape.getMinCount();
    Integer maxCount = shape.getMaxCount();
    if (minCount == null && maxCount == null) {
      return List.of();
    }

    int count = ConstraintHelpers.getPropertyValues(graph, focusNode, shape.getPath()).size();
    List<ValidationResult> results = new ArrayList<>();
    if (minCount != null && count < minCount) {
      results.add(ConstraintHelpers.buildViolation(focusNode, shape, null,
          "Property has too few values (expected at least " + minCount + ", found " + count + ")",
          Map.of(CONSTRAINT_COMPONENT, Sh.MIN_COUNT_COMPONENT,
              "min_count", minCount,
              "actual_count", count)));
    }
    if (maxCount != null && count > maxCount) {
      results.add(ConstraintHelpers.buildViolation(focusNode, shape, null,
          "Property has too many values (expected at most " + maxCount + ", found " + count + ")",
          Map.of(CONSTRAINT_COMPONENT, Sh.MAX_COUNT_COMPONENT,
              "max_count", maxCount,
              "actual_count", count)));
    }
    return results;
  }
}
