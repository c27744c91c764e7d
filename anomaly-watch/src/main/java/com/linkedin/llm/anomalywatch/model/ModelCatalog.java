/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;


/**
 * Static knowledge about models: cheaper alternatives and context window sizes. A model name matches a catalog entry if
 * it contains the entry's pattern, ignoring case; entries are consulted in the order they were added, so more specific
 * patterns must be added before the patterns they contain.
 * <p>
 * The catalog is immutable once built and is shared by every component that needs it.
 */
public class ModelCatalog {
  private final List<Entry<List<ModelAlternative>>> _alternatives;
  private final List<Entry<Integer>> _contextWindows;

  private ModelCatalog(List<Entry<List<ModelAlternative>>> alternatives, List<Entry<Integer>> contextWindows) {
    _alternatives = Collections.unmodifiableList(new ArrayList<>(alternatives));
    _contextWindows = Collections.unmodifiableList(new ArrayList<>(contextWindows));
  }

  /**
   * @return The catalog of well known OpenAI and Anthropic models.
   */
  public static ModelCatalog defaultCatalog() {
    return builder()
        .alternatives(List.of("gpt-4"), new ModelAlternative("gpt-3.5-turbo", 0.1, 0.7))
        .alternatives(List.of("gpt-3.5-turbo"), new ModelAlternative("gpt-3.5-turbo-instruct", 0.8, 0.9))
        .alternatives(List.of("claude-v2", "claude-2"), new ModelAlternative("claude-instant-v1", 0.4, 0.8))
        .contextWindow(List.of("gpt-4-32k"), 32768)
        .contextWindow(List.of("gpt-4"), 8192)
        .contextWindow(List.of("gpt-3.5-turbo-16k"), 16384)
        .contextWindow(List.of("gpt-3.5-turbo"), 4096)
        .contextWindow(List.of("claude-2", "claude-v2"), 100000)
        .contextWindow(List.of("claude-instant"), 100000)
        .build();
  }

  /**
   * @param model Model name.
   * @return Cheaper alternatives of the given model, empty if none is known.
   */
  public List<ModelAlternative> alternativesFor(String model) {
    List<ModelAlternative> alternatives = lookup(_alternatives, model);
    return alternatives == null ? Collections.emptyList() : alternatives;
  }

  /**
   * @param model Model name.
   * @return The context window of the given model in tokens, or {@code null} if unknown.
   */
  public Integer contextWindow(String model) {
    return lookup(_contextWindows, model);
  }

  private static <V> V lookup(List<Entry<V>> entries, String model) {
    String modelLower = model.toLowerCase(Locale.ROOT);
    for (Entry<V> entry : entries) {
      for (String pattern : entry._patterns) {
        if (modelLower.contains(pattern)) {
          return entry._value;
        }
      }
    }
    return null;
  }

  public static Builder builder() {
    return new Builder();
  }

  private static final class Entry<V> {
    private final List<String> _patterns;
    private final V _value;

    private Entry(List<String> patterns, V value) {
      List<String> lowerCasePatterns = new ArrayList<>(patterns.size());
      patterns.forEach(p -> lowerCasePatterns.add(p.toLowerCase(Locale.ROOT)));
      _patterns = Collections.unmodifiableList(lowerCasePatterns);
      _value = value;
    }
  }

  public static final class Builder {
    private final List<Entry<List<ModelAlternative>>> _alternatives = new ArrayList<>();
    private final List<Entry<Integer>> _contextWindows = new ArrayList<>();

    private Builder() {

    }

    public Builder alternatives(List<String> patterns, ModelAlternative... alternatives) {
      _alternatives.add(new Entry<>(patterns, List.of(alternatives)));
      return this;
    }

    public Builder contextWindow(List<String> patterns, int contextWindowTokens) {
      if (contextWindowTokens <= 0) {
        throw new IllegalArgumentException("Context window must be positive, got " + contextWindowTokens);
      }
      _contextWindows.add(new Entry<>(patterns, contextWindowTokens));
      return this;
    }

    public ModelCatalog build() {
      return new ModelCatalog(_alternatives, _contextWindows);
    }
  }
}
