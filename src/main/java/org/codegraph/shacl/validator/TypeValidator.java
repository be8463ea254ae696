package org.codegraph.shacl.validator;

import static org.codegraph.shacl.validator.ConstraintHelpers.ACTUAL_VALUE;
import static org.codegraph.shacl.validator.ConstraintHelpers.CONSTRAINT_COMPONENT;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Iri;
import org.codegraph.shacl.domain.NodeKind;
import org.codegraph.shacl.domain.NodeShape;
import org.codegraph.shacl.domain.PropertyShape;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.domain.ValidationResult;
import org.codegraph.shacl.vocabulary.Sh;
import org.springframework.stereotype.Component;

/**
 * Validates {@code sh:datatype}, {@code sh:class} and (node-level)
 * {@code sh:nodeKind}.
 *
 * <p>Datatype and class checks are independent, so one value can produce two
 * violations. Class membership is a direct {@code rdf:type} check.</p>
 */
@Component
public class TypeValidator implements ConstraintValidator {

  @Override
  public List<ValidationResult> validate(Graph graph, Term focusNode, PropertyShape shape) {
    Iri datatype = shape.getDatatype();
    Iri classIri = shape.getClassIri();
    if (datatype == null && classIri == null) {
      return List.of();
    }

    List<Term> values = ConstraintHelpers.getPropertyValues(graph, focusNode, shape.getPath());
    List<ValidationResult> results = new ArrayList<>();
    if (datatype != null) {
      for (Term value : values) {
        if (!ConstraintHelpers.isDatatype(value, datatype)) {
          results.add(ConstraintHelpers.buildViolation(focusNode, shape, value,
              "Value does not have required datatype " + datatype,
              Map.of(CONSTRAINT_COMPONENT, Sh.DATATYPE_COMPONENT,
                  "expected_datatype", datatype,
                  ACTUAL_VALUE, value)));
        }
      }
    }
    if (classIri != null) {
      for (Term value : values) {
        if (!ConstraintHelpers.isInstanceOf(graph, value, classIri)) {
          results.add(ConstraintHelpers.buildViolation(focusNode, shape, value,
              "Value is not an instance of class " + classIri,
              Map.of(CONSTRAINT_COMPONENT, Sh.CLASS_COMPONENT,
                  "expected_class", classIri,
                  ACTUAL_VALUE, value)));
        }
      }
    }
    return results;
  }

  @Override
  public List<ValidationResult> validateNode(Graph graph, Term focusNode, NodeShape shape) {
    List<ValidationResult> results = new ArrayList<>();

    Iri datatype = shape.getDatatype();
    if (datatype != null && !ConstraintHelpers.isDatatype(focusNode, datatype)) {
      results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
          "Focus node does not have required datatype " + datatype,
          Map.of(CONSTRAINT_COMPONENT, Sh.DATATYPE_COMPONENT,
              "expected_datatype", datatype,
              ACTUAL_VALUE, focusNode)));
    }

    Iri classIri = shape.getClassIri();
    if (classIri != null && !ConstraintHelpers.isInstanceOf(graph, focusNode, classIri)) {
      results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
          "Focus node is not an instance of class " + classIri,
          Map.of(CONSTRAINT_COMPONENT, Sh.CLASS_COMPONENT,
              "expected_class", classIri,
              ACTUAL_VALUE, focusNode)));
    }

    NodeKind nodeKind = shape.getNodeKind();
    if (nodeKind != null && !ConstraintHelpers.isNodeKind(focusNode, nodeKind)) {
      results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
          "Focus node does not match required node kind " + nodeKind.iri(),
          Map.of(CONSTRAINT_COMPONENT, Sh.NODE_KIND_COMPONENT,
              "expected_node_kind", nodeKind.iri(),
              ACTUAL_VALUE, focusNode)));
    }
    return results;
  }
}
