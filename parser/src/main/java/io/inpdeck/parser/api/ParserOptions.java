package io.inpdeck.parser.api;

import io.inpdeck.utils.Names;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable parser configuration. Instances are created through {@link #builder()} and may be
 * shared between threads and parses.
 */
public final class ParserOptions {
  public static final String DEFAULT_COMMENT_CHARS = "!#";
  public static final int DEFAULT_MAX_INCLUDE_DEPTH = 32;

  private static final ParserOptions DEFAULTS = builder().build();

  private final Set<Character> commentChars;
  private final Map<String, String> variables;
  private final BareIfPolicy bareIfPolicy;
  private final IncludeResolver includeResolver;
  private final int maxIncludeDepth;

  private ParserOptions(Builder b) {
    this.commentChars = Collections.unmodifiableSet(new LinkedHashSet<>(b.commentChars));
    this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(b.variables));
    this.bareIfPolicy = b.bareIfPolicy;
    this.includeResolver = b.includeResolver;
    this.maxIncludeDepth = b.maxIncludeDepth;
  }

  public static ParserOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Characters that start a comment running to the end of the line. */
  public Set<Character> commentChars() {
    return commentChars;
  }

  /** Seed variables, applied as if set by {@code @SET} before the first line. */
  public Map<String, String> variables() {
    return variables;
  }

  public BareIfPolicy bareIfPolicy() {
    return bareIfPolicy;
  }

  public IncludeResolver includeResolver() {
    return includeResolver;
  }

  public int maxIncludeDepth() {
    return maxIncludeDepth;
  }

  /** Returns a builder pre-populated with these options. */
  public Builder toBuilder() {
    Builder b = new Builder();
    b.commentChars.clear();
    b.commentChars.addAll(commentChars);
    b.variables.putAll(variables);
    b.bareIfPolicy = bareIfPolicy;
    b.includeResolver = includeResolver;
    b.maxIncludeDepth = maxIncludeDepth;
    return b;
  }

  /** Builder for {@link ParserOptions}. */
  public static final class Builder {
    private final Set<Character> commentChars = new LinkedHashSet<>();
    private final Map<String, String> variables = new LinkedHashMap<>();
    private BareIfPolicy bareIfPolicy = BareIfPolicy.FAIL;
    private IncludeResolver includeResolver = IncludeResolver.DISABLED;
    private int maxIncludeDepth = DEFAULT_MAX_INCLUDE_DEPTH;

    private Builder() {
      commentChars(DEFAULT_COMMENT_CHARS);
    }

    /**
     * Replaces the comment introducers.
     *
     * @param chars every character of this string starts a comment
     * @return this builder
     * @throws IllegalArgumentException if a character is a quote, whitespace, or empty input
     */
    public Builder commentChars(String chars) {
      Objects.requireNonNull(chars, "chars");
      if (chars.isEmpty()) {
        throw new IllegalArgumentException("At least one comment character is required");
      }
      Set<Character> parsed = new LinkedHashSet<>();
      for (char c : chars.toCharArray()) {
        if (c == '\'' || c == '"' || Character.isWhitespace(c)) {
          throw new IllegalArgumentException("Invalid comment character: '" + c + "'");
        }
        parsed.add(c);
      }
      commentChars.clear();
      commentChars.addAll(parsed);
      return this;
    }

    /**
     * Adds a seed variable.
     *
     * @param name variable name, matched case-insensitively
     * @param value the text substituted for references
     * @return this builder
     * @throws IllegalArgumentException if the name is not a valid identifier
     */
    public Builder variable(String name, String value) {
      if (!Names.isIdentifier(name)) {
        throw new IllegalArgumentException("Invalid variable name: " + name);
      }
      variables.put(name, Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder variables(Map<String, String> values) {
      values.forEach(this::variable);
      return this;
    }

    public Builder bareIfPolicy(BareIfPolicy policy) {
      this.bareIfPolicy = Objects.requireNonNull(policy, "policy");
      return this;
    }

    public Builder includeResolver(IncludeResolver resolver) {
      this.includeResolver = Objects.requireNonNull(resolver, "resolver");
      return this;
    }

    public Builder maxIncludeDepth(int depth) {
      if (depth < 0) {
        throw new IllegalArgumentException("Include depth must not be negative: " + depth);
      }
      this.maxIncludeDepth = depth;
      return this;
    }

    public ParserOptions build() {
      return new ParserOptions(this);
    }
  }
}
