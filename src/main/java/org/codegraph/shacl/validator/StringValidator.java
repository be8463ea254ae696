package org.codegraph.shacl.validator;

import static org.codegraph.shacl.validator.ConstraintHelpers.ACTUAL_VALUE;
import static org.codegraph.shacl.validator.ConstraintHelpers.CONSTRAINT_COMPONENT;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.codegraph.shacl.domain.Graph;
import org.codegraph.shacl.domain.Literal;
import org.codegraph.shacl.domain.NodeShape;
import org.codegraph.shacl.domain.PropertyShape;
import org.codegraph.shacl.domain.Term;
import org.codegraph.shacl.domain.ValidationResult;
import org.codegraph.shacl.vocabulary.Sh;
import org.springframework.stereotype.Component;

/**
 * Validates {@code sh:pattern}, {@code sh:minLength}, {@code sh:maxLength} and
 * (node-level) {@code sh:languageIn}.
 *
 * <p>Only literals are checked; IRIs and blank nodes are skipped. Patterns match
 * anywhere in the lexical form unless anchored. Lengths count code points.</p>
 */
@Component
public class StringValidator implements ConstraintValidator {

  @Override
  public List<ValidationResult> validate(Graph graph, Term focusNode, PropertyShape shape) {
    if (shape.getPattern() == null && shape.getMinLength() == null
        && shape.getMaxLength() == null) {
      return List.of();
    }

    List<ValidationResult> results = new ArrayList<>();
    for (Term value : ConstraintHelpers.getPropertyValues(graph, focusNode, shape.getPath())) {
      Optional<String> text = ConstraintHelpers.extractString(value);
      if (text.isEmpty()) {
        continue;
      }
      String actual = text.get();

      Pattern pattern = shape.getPattern();
      if (pattern != null && !pattern.matcher(actual).find()) {
        results.add(ConstraintHelpers.buildViolation(focusNode, shape, value,
            "Value does not match required pattern " + pattern.pattern(),
            patternDetails(pattern, actual)));
      }

      int length = ConstraintHelpers.length(actual);
      Integer minLength = shape.getMinLength();
      if (minLength != null && length < minLength) {
        results.add(ConstraintHelpers.buildViolation(focusNode, shape, value,
            "Value is too short (expected at least " + minLength
                + " characters, found " + length + ")",
            Map.of(CONSTRAINT_COMPONENT, Sh.MIN_LENGTH_COMPONENT,
                "min_length", minLength,
                "actual_length", length,
                ACTUAL_VALUE, actual)));
      }

      Integer maxLength = shape.getMaxLength();
      if (maxLength != null && length > maxLength) {
        results.add(ConstraintHelpers.buildViolation(focusNode, shape, value,
            "Value is too long (expected at most " + maxLength
                + " characters, found " + length + ")",
            Map.of(CONSTRAINT_COMPONENT, Sh.MAX_LENGTH_COMPONENT,
                "max_length", maxLength,
                "actual_length", length,
                ACTUAL_VALUE, actual)));
      }
    }
    return results;
  }

  @Override
  public List<ValidationResult> validateNode(Graph graph, Term focusNode, NodeShape shape) {
    List<ValidationResult> results = new ArrayList<>();

    Optional<String> text = ConstraintHelpers.extractString(focusNode);
    if (text.isPresent()) {
      String actual = text.get();
      Pattern pattern = shape.getPattern();
      if (pattern != null && !pattern.matcher(actual).find()) {
        results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
            "Focus node does not match required pattern " + pattern.pattern(),
            patternDetails(pattern, actual)));
      }

      int length = ConstraintHelpers.length(actual);
      Integer minLength = shape.getMinLength();
      if (minLength != null && length < minLength) {
        results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
            "Focus node is too short (expected at least " + minLength
                + " characters, found " + length + ")",
            Map.of(CONSTRAINT_COMPONENT, Sh.MIN_LENGTH_COMPONENT,
                "min_length", minLength,
                "actual_length", length,
                ACTUAL_VALUE, actual)));
      }

      Integer maxLength = shape.getMaxLength();
      if (maxLength != null && length > maxLength) {
        results.add(ConstraintHelpers.buildNodeViolation(focusNode, shape,
            "Focus node is too long (expected at most " + maxLength
                + " characters, found " + length + ")",
            Map.of(CONSTRAINT_COMPONENT, Sh.MAX_LENGTH_COMPONENT,
                "max_length", maxLength,
                "actual_length", length,
                ACTUAL_VALUE, actual)));
      }
    }

    List<String> allowed = shape.getLanguageIn();
    if (!allowed.isEmpty()) {
      checkLanguageIn(focusNode, shape, allowed).ifPresent(results::add);
    }
    return results;
  }

  private Optional<ValidationResult> checkLanguageIn(
      Term focusNode, NodeShape shape, List<String> allowed) {
    if (!(focusNode instanceof Literal literal)) {
      return Optional.of(ConstraintHelpers.buildNodeViolation(focusNode, shape,
          "Focus node must be a literal with a language tag",
          Map.of(CONSTRAINT_COMPONENT, Sh.LANGUAGE_IN_COMPONENT,
              "allowed_languages", allowed,
              ACTUAL_VALUE, focusNode)));
    }
    if (!literal.hasLanguage()) {
      return Optional.of(ConstraintHelpers.buildNodeViolation(focusNode, shape,
          "Focus node must have a language tag",
          Map.of(CONSTRAINT_COMPONENT, Sh.LANGUAGE_IN_COMPONENT,
              "allowed_languages", allowed,
              ACTUAL_VALUE, focusNode)));
    }
    // Language tags compare case-insensitively
    boolean permitted = allowed.stream().anyMatch(tag -> tag.equalsIgnoreCase(literal.language()));
    if (permitted) {
      return Optional.empty();
    }
    return Optional.of(ConstraintHelpers.buildNodeViolation(focusNode, shape,
        "Language tag '" + literal.language() + "' is not in the allowed list",
        Map.of(CONSTRAINT_COMPONENT, Sh.LANGUAGE_IN_COMPONENT,
            "allowed_languages", allowed,
            "actual_language", literal.language(),
            ACTUAL_VALUE, focusNode)));
  }

  private static Map<String, Object> patternDetails(Pattern pattern, String actual) {
    return Map.of(CONSTRAINT_COMPONENT, Sh.PATTERN_COMPONENT,
        "pattern", pattern.pattern(),
        ACTUAL_VALUE, actual);
  }
}
