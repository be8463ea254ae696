package org.codegraph.shacl.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One detected non-conformance. Violations, warnings and info results share
 * this structure and differ only by {@link Severity}.
 *
 * @param focusNode the node that was checked
 * @param resultPath the property path, or null for node-level results
 * @param value the offending value, or null
 * @param message the human readable message (never null)
 * @param severity the severity
 * @param sourceShape the shape that produced the result, or null
 * @param constraintComponent the constraint component IRI, or null
 * @param details additional diagnostics keyed by name (insertion ordered)
 */
public record ValidationResult(
    Term focusNode,
    Iri resultPath,
    Term value,
    String message,
    Severity severity,
    Term sourceShape,
    Iri constraintComponent,
    Map<String, Object> details) {

  /**
   * Creates a new ValidationResult with validation.
   */
  public ValidationResult {
    Objects.requireNonNull(focusNode, "ValidationResult focusNode cannot be null");
    Objects.requireNonNull(severity, "ValidationResult severity cannot be null");
    message = message == null ? "" : message;
    details = details == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  /**
   * Creates a builder for a result on the given focus node.
   *
   * @param focusNode the focus node
   * @return a new builder
   */
  public static Builder builder(Term focusNode) {
    return new Builder(focusNode);
  }

  /**
   * Builder for {@link ValidationResult}. Severity defaults to {@link Severity#VIOLATION}.
   */
  public static final class Builder {
    private final Term focusNode;
    private Iri resultPath;
    private Term value;
    private String message;
    private Severity severity = Severity.VIOLATION;
    private Term sourceShape;
    private Iri constraintComponent;
    private final Map<String, Object> details = new LinkedHashMap<>();

    private Builder(Term focusNode) {
      this.focusNode = focusNode;
    }

    public Builder resultPath(Iri resultPath) {
      this.resultPath = resultPath;
      return this;
    }

    public Builder value(Term value) {
      this.value = value;
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder severity(Severity severity) {
      this.severity = severity;
      return this;
    }

    public Builder sourceShape(Term sourceShape) {
      this.sourceShape = sourceShape;
      return this;
    }

    public Builder constraintComponent(Iri constraintComponent) {
      this.constraintComponent = constraintComponent;
      return this;
    }

    public Builder detail(String key, Object detailValue) {
      this.details.put(key, detailValue);
      return this;
    }

    public Builder details(Map<String, ?> more) {
      this.details.putAll(more);
      return this;
    }

    public ValidationResult build() {
      return new ValidationResult(focusNode, resultPath, value, message, severity,
          sourceShape, constraintComponent, details);
    }
  }
}
