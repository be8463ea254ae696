package org.codegraph.shacl.validator;

import static org.codegraph.shacl.validator.ConstraintHelpers.CONSTRAINT_COMPONENT;

import java.util.List;
import java.util.Map;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Iri;
import org.codegraph.shacl.domain.PropertyShape;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.domain.ValidationResult;
import org.codegraph.shacl.vocabulary.Sh;
import org.springframework.stereotype.Component;

/**
 * Validates {@code sh:qualifiedValueShape} restricted to an {@code sh:class}
 * together with {@code sh:qualifiedMinCount}. Both must be present for the
 * check to run.
 */
@Component
public class QualifiedValidator implements ConstraintValidator {

  @Override
  public List<ValidationResult> validate(Graph graph, Term focusNode, PropertyShape shape) {
    Iri qualifiedClass = shape.getQualifiedClass();
    Integer minCount = shape.getQualifiedMinCount();
    if (qualifiedClass == null || minCount == null) {
      return List.of();
    }

    List<Term> values = ConstraintHelpers.getPropertyValues(graph, focusNode, shape.getPath());
    long qualified = values.stream()
        .filter(value -> ConstraintHelpers.isInstanceOf(graph, value, qualifiedClass))
        .count();
    if (qualified >= minCount) {
      return List.of();
    }

    return List.of(ConstraintHelpers.buildViolation(focusNode, shape, null,
        "Property has too few values of required type (expected at least " + minCount
            + " instances of " + qualifiedClass + ", found " + qualified + ")",
        Map.of(CONSTRAINT_COMPONENT, Sh.QUALIFIED_MIN_COUNT_COMPONENT,
            "qualified_class", qualifiedClass,
            "qualified_min_count", minCount,
            "actual_qualified_count", (int) qualified,
            "total_values", values.size())));
  }
}
