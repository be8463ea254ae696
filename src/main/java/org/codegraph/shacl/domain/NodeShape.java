package org.codegraph.shacl.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A shape whose constraints apply to the focus node itself, together with the
 * targets that select focus nodes and the property shapes and query-based
 * constraints checked for each of them.
 *
 * <p>Numeric bounds are kept as terms because shapes graphs supply them as
 * literals; validators unwrap them before comparing.</p>
 */
public final class NodeShape {

  private final Term id;
  private final List<Iri> targetClasses;
  private final List<Term> targetNodes;
  private final boolean implicitClassTarget;
  private final List<PropertyShape> propertyShapes;
  private final List<SparqlConstraint> sparqlConstraints;
  private final String message;
  private final Iri datatype;
  private final Iri classIri;
  private final NodeKind nodeKind;
  private final Pattern pattern;
  private final Integer minLength;
  private final Integer maxLength;
  private final List<String> languageIn;
  private final List<Term> in;
  private final Term hasValue;
  private final Term minInclusive;
  private final Term maxInclusive;
  private final Term minExclusive;
  private final Term maxExclusive;
  private final List<Term> and;
  private final List<Term> or;
  private final List<Term> xone;
  private final Term not;

  private NodeShape(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "NodeShape id cannot be null");
    this.targetClasses = List.copyOf(builder.targetClasses);
    this.targetNodes = List.copyOf(builder.targetNodes);
    this.implicitClassTarget = builder.implicitClassTarget;
    this.propertyShapes = List.copyOf(builder.propertyShapes);
    this.sparqlConstraints = List.copyOf(builder.sparqlConstraints);
    this.message = builder.message;
    this.datatype = builder.datatype;
    this.classIri = builder.classIri;
    this.nodeKind = builder.nodeKind;
    this.pattern = builder.pattern;
    this.minLength = PropertyShape.requireNonNegative(builder.minLength, "minLength");
    this.maxLength = PropertyShape.requireNonNegative(builder.maxLength, "maxLength");
    this.languageIn = List.copyOf(builder.languageIn);
    this.in = List.copyOf(builder.in);
    this.hasValue = builder.hasValue;
    this.minInclusive = builder.minInclusive;
    this.maxInclusive = builder.maxInclusive;
    this.minExclusive = builder.minExclusive;
    this.maxExclusive = builder.maxExclusive;
    this.and = List.copyOf(builder.and);
    this.or = List.copyOf(builder.or);
    this.xone = List.copyOf(builder.xone);
    this.not = builder.not;
  }

  /**
   * Creates a builder for a node shape with the given identifier.
   *
   * @param id the shape identifier
   * @return a new builder
   */
  public static Builder builder(Term id) {
    return new Builder().id(id);
  }

  public Term getId() {
    return id;
  }

  public List<Iri> getTargetClasses() {
    return targetClasses;
  }

  public List<Term> getTargetNodes() {
    return targetNodes;
  }

  /**
   * Whether this shape is also an {@code rdfs:Class} and so targets its own instances.
   *
   * @return true if the implicit class target is active
   */
  public boolean isImplicitClassTarget() {
    return implicitClassTarget;
  }

  public List<PropertyShape> getPropertyShapes() {
    return propertyShapes;
  }

  public List<SparqlConstraint> getSparqlConstraints() {
    return sparqlConstraints;
  }

  public String getMessage() {
    return message;
  }

  public Iri getDatatype() {
    return datatype;
  }

  public Iri getClassIri() {
    return classIri;
  }

  public NodeKind getNodeKind() {
    return nodeKind;
  }

  public Pattern getPattern() {
    return pattern;
  }

  public Integer getMinLength() {
    return minLength;
  }

  public Integer getMaxLength() {
    return maxLength;
  }

  public List<String> getLanguageIn() {
    return languageIn;
  }

  public List<Term> getIn() {
    return in;
  }

  public Term getHasValue() {
    return hasValue;
  }

  public Term getMinInclusive() {
    return minInclusive;
  }

  public Term getMaxInclusive() {
    return maxInclusive;
  }

  public Term getMinExclusive() {
    return minExclusive;
  }

  public Term getMaxExclusive() {
    return maxExclusive;
  }

  public List<Term> getAnd() {
    return and;
  }

  public List<Term> getOr() {
    return or;
  }

  public List<Term> getXone() {
    return xone;
  }

  public Term getNot() {
    return not;
  }

  /**
   * Checks whether any logical constraint ({@code and}, {@code or}, {@code xone},
   * {@code not}) is active.
   *
   * @return true if at least one logical constraint is present
   */
  public boolean hasLogicalConstraints() {
    return !and.isEmpty() || !or.isEmpty() || !xone.isEmpty() || not != null;
  }

  @Override
  public String toString() {
    return "NodeShape{id=" + id
        + ", targetClasses=" + targetClasses
        + ", properties=" + propertyShapes.size()
        + ", sparql=" + sparqlConstraints.size() + "}";
  }

  /**
   * Builder for {@link NodeShape}.
   */
  public static final class Builder {
    private Term id;
    private final List<Iri> targetClasses = new ArrayList<>();
    private final List<Term> targetNodes = new ArrayList<>();
    private boolean implicitClassTarget;
    private final List<PropertyShape> propertyShapes = new ArrayList<>();
    private final List<SparqlConstraint> sparqlConstraints = new ArrayList<>();
    private String message;
    private Iri datatype;
    private Iri classIri;
    private NodeKind nodeKind;
    private Pattern pattern;
    private Integer minLength;
    private Integer maxLength;
    private final List<String> languageIn = new ArrayList<>();
    private final List<Term> in = new ArrayList<>();
    private Term hasValue;
    private Term minInclusive;
    private Term maxInclusive;
    private Term minExclusive;
    private Term maxExclusive;
    private final List<Term> and = new ArrayList<>();
    private final List<Term> or = new ArrayList<>();
    private final List<Term> xone = new ArrayList<>();
    private Term not;

    private Builder() {
    }

    public Builder id(Term id) {
      this.id = id;
      return this;
    }

    public Builder targetClass(Iri targetClass) {
      this.targetClasses.add(targetClass);
      return this;
    }

    public Builder targetNode(Term targetNode) {
      this.targetNodes.add(targetNode);
      return this;
    }

    public Builder implicitClassTarget(boolean implicitClassTarget) {
      this.implicitClassTarget = implicitClassTarget;
      return this;
    }

    public Builder property(PropertyShape propertyShape) {
      this.propertyShapes.add(propertyShape);
      return this;
    }

    public Builder sparql(SparqlConstraint constraint) {
      this.sparqlConstraints.add(constraint);
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder datatype(Iri datatype) {
      this.datatype = datatype;
      return this;
    }

    public Builder classIri(Iri classIri) {
      this.classIri = classIri;
      return this;
    }

    public Builder nodeKind(NodeKind nodeKind) {
      this.nodeKind = nodeKind;
      return this;
    }

    public Builder pattern(Pattern pattern) {
      this.pattern = pattern;
      return this;
    }

    public Builder pattern(String regex) {
      this.pattern = regex == null ? null : Pattern.compile(regex);
      return this;
    }

    public Builder minLength(Integer minLength) {
      this.minLength = minLength;
      return this;
    }

    public Builder maxLength(Integer maxLength) {
      this.maxLength = maxLength;
      return this;
    }

    public Builder languageIn(List<String> languages) {
      this.languageIn.clear();
      this.languageIn.addAll(languages);
      return this;
    }

    public Builder in(List<? extends Term> values) {
      this.in.clear();
      this.in.addAll(values);
      return this;
    }

    public Builder hasValue(Term hasValue) {
      this.hasValue = hasValue;
      return this;
    }

    public Builder minInclusive(Term minInclusive) {
      this.minInclusive = minInclusive;
      return this;
    }

    public Builder maxInclusive(Term maxInclusive) {
      this.maxInclusive = maxInclusive;
      return this;
    }

    public Builder minExclusive(Term minExclusive) {
      this.minExclusive = minExclusive;
      return this;
    }

    public Builder maxExclusive(Term maxExclusive) {
      this.maxExclusive = maxExclusive;
      return this;
    }

    public Builder and(List<? extends Term> shapes) {
      this.and.clear();
      this.and.addAll(shapes);
      return this;
    }

    public Builder or(List<? extends Term> shapes) {
      this.or.clear();
      this.or.addAll(shapes);
      return this;
    }

    public Builder xone(List<? extends Term> shapes) {
      this.xone.clear();
      this.xone.addAll(shapes);
      return this;
    }

    public Builder not(Term shape) {
      this.not = shape;
      return this;
    }

    public NodeShape build() {
      return new NodeShape(this);
    }
  }
}
