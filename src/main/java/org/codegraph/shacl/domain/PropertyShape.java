package org.codegraph.shacl.domain;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Constraints applied to the values reached from a focus node through a single
 * predicate path.
 *
 * <p>Every constraint field is optional. A null field (or an empty {@code in}
 * list) means the constraint is inactive; a shape with no active constraint
 * always conforms.</p>
 */
public final class PropertyShape {

  private final Term id;
  private final Iri path;
  private final String message;
  private final Integer minCount;
  private final Integer maxCount;
  private final Iri datatype;
  private final Iri classIri;
  private final Pattern pattern;
  private final Integer minLength;
  private final Integer maxLength;
  private final List<Term> in;
  private final Term hasValue;
  private final BigDecimal minInclusive;
  private final BigDecimal maxInclusive;
  private final BigDecimal minExclusive;
  private final BigDecimal maxExclusive;
  private final Iri qualifiedClass;
  private final Integer qualifiedMinCount;

  private PropertyShape(Builder builder) {
    this.id = builder.id != null ? builder.id : BlankNode.generate();
    this.path = Objects.requireNonNull(builder.path, "PropertyShape path cannot be null");
    this.message = builder.message;
    this.minCount = requireNonNegative(builder.minCount, "minCount");
    this.maxCount = requireNonNegative(builder.maxCount, "maxCount");
    this.datatype = builder.datatype;
    this.classIri = builder.classIri;
    this.pattern = builder.pattern;
    this.minLength = requireNonNegative(builder.minLength, "minLength");
    this.maxLength = requireNonNegative(builder.maxLength, "maxLength");
    this.in = List.copyOf(builder.in);
    this.hasValue = builder.hasValue;
    this.minInclusive = builder.minInclusive;
    this.maxInclusive = builder.maxInclusive;
    this.minExclusive = builder.minExclusive;
    this.maxExclusive = builder.maxExclusive;
    this.qualifiedClass = builder.qualifiedClass;
    this.qualifiedMinCount = requireNonNegative(builder.qualifiedMinCount, "qualifiedMinCount");
  }

  static Integer requireNonNegative(Integer value, String name) {
    if (value != null && value < 0) {
      throw new IllegalArgumentException(name + " cannot be negative: " + value);
    }
    return value;
  }

  /**
   * Creates a builder for a property shape on the given path.
   *
   * @param path the predicate IRI
   * @return a new builder
   */
  public static Builder builder(Iri path) {
    return new Builder().path(path);
  }

  public Term getId() {
    return id;
  }

  public Iri getPath() {
    return path;
  }

  public String getMessage() {
    return message;
  }

  public Integer getMinCount() {
    return minCount;
  }

  public Integer getMaxCount() {
    return maxCount;
  }

  public Iri getDatatype() {
    return datatype;
  }

  public Iri getClassIri() {
    return classIri;
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

  public List<Term> getIn() {
    return in;
  }

  public Term getHasValue() {
    return hasValue;
  }

  public BigDecimal getMinInclusive() {
    return minInclusive;
  }

  public BigDecimal getMaxInclusive() {
    return maxInclusive;
  }

  public BigDecimal getMinExclusive() {
    return minExclusive;
  }

  public BigDecimal getMaxExclusive() {
    return maxExclusive;
  }

  public Iri getQualifiedClass() {
    return qualifiedClass;
  }

  public Integer getQualifiedMinCount() {
    return qualifiedMinCount;
  }

  @Override
  public String toString() {
    return "PropertyShape{id=" + id + ", path=" + path + "}";
  }

  /**
   * Builder for {@link PropertyShape}.
   */
  public static final class Builder {
    private Term id;
    private Iri path;
    private String message;
    private Integer minCount;
    private Integer maxCount;
    private Iri datatype;
    private Iri classIri;
    private Pattern pattern;
    private Integer minLength;
    private Integer maxLength;
    private final List<Term> in = new ArrayList<>();
    private Term hasValue;
    private BigDecimal minInclusive;
    private BigDecimal maxInclusive;
    private BigDecimal minExclusive;
    private BigDecimal maxExclusive;
    private Iri qualifiedClass;
    private Integer qualifiedMinCount;

    private Builder() {
    }

    public Builder id(Term id) {
      this.id = id;
      return this;
    }

    public Builder path(Iri path) {
      this.path = path;
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder minCount(Integer minCount) {
      this.minCount = minCount;
      return this;
    }

    public Builder maxCount(Integer maxCount) {
      this.maxCount = maxCount;
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

    public Builder in(List<? extends Term> values) {
      this.in.clear();
      this.in.addAll(values);
      return this;
    }

    public Builder hasValue(Term hasValue) {
      this.hasValue = hasValue;
      return this;
    }

    public Builder minInclusive(BigDecimal minInclusive) {
      this.minInclusive = minInclusive;
      return this;
    }

    public Builder maxInclusive(BigDecimal maxInclusive) {
      this.maxInclusive = maxInclusive;
      return this;
    }

    public Builder minExclusive(BigDecimal minExclusive) {
      this.minExclusive = minExclusive;
      return this;
    }

    public Builder maxExclusive(BigDecimal maxExclusive) {
      this.maxExclusive = maxExclusive;
      return this;
    }

    public Builder qualifiedClass(Iri qualifiedClass) {
      this.qualifiedClass = qualifiedClass;
      return this;
    }

    public Builder qualifiedMinCount(Integer qualifiedMinCount) {
      this.qualifiedMinCount = qualifiedMinCount;
      return this;
    }

    public PropertyShape build() {
      return new PropertyShape(this);
    }
  }
}
