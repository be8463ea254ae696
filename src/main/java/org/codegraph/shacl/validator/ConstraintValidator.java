package org.codegraph.shacl.validator;

import java.util.List;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.NodeShape;
import org.codegraph.shacl.domain.PropertyShape;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.domain.ValidationResult;

/**
 * One family of built-in constraints. Implementations are stateless and never
 * modify the graph; an inactive constraint contributes no results.
 */
public interface ConstraintValidator {

  /**
   * Checks the values reached from the focus node through the shape's path.
   *
   * @param graph the data graph
   * @param focusNode the focus node
   * @param shape the property shape
   * @return violations in detection order (empty if conformant)
   */
  List<ValidationResult> validate(Graph graph, Term focusNode, PropertyShape shape);

  /**
   * Checks the focus node itself against the node-level constraints of a shape.
   *
   * @param graph the data graph
   * @param focusNode the focus node
   * @param shape the node shape
   * @return violations in detection order (empty if conformant)
   */
  default List<ValidationResult> validateNode(Graph graph, Term focusNode, NodeShape shape) {
    return List.of();
  }
}
