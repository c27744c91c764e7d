/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.anomalywatch.common.config;

import com.linkedin.anomalywatch.common.AnomalyWatchConfigurable;
import com.linkedin.anomalywatch.common.utils.Utils;
import com.linkedin.anomalywatch.exception.AnomalyWatchException;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A convenient base class for configurations to extend.
 * <p>
 * This class holds both the original configuration that was provided as well as the parsed values.
 */
public class AbstractConfig {

  public static final String NL = System.lineSeparator();

  private final Logger _log = LoggerFactory.getLogger(getClass());

  /* configs for which values have been requested, used to detect unused configs */
  private final Set<String> _used;

  /* the original values passed in by the user */
  private final Map<String, ?> _originals;

  /* the parsed values */
  private final Map<String, Object> _values;

  @SuppressWarnings("unchecked")
  public AbstractConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
    for (Map.Entry<?, ?> entry : originals.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new ConfigException(entry.getKey().toString(), entry.getValue(), "Key must be a string.");
      }
    }
    _originals = Collections.unmodifiableMap(new HashMap<>((Map<String, ?>) originals));
    _values = definition.parse(_originals);
    _used = Collections.synchronizedSet(new HashSet<>());
    if (doLog) {
      logAll();
    }
  }

  public AbstractConfig(ConfigDef definition, Map<?, ?> originals) {
    this(definition, originals, true);
  }

  protected Object get(String key) {
    if (!_values.containsKey(key)) {
      throw new ConfigException(String.format("Unknown configuration '%s'", key));
    }
    _used.add(key);
    return _values.get(key);
  }

  public Integer getInt(String key) {
    return (Integer) get(key);
  }

  public Long getLong(String key) {
    return (Long) get(key);
  }

  public Double getDouble(String key) {
    return (Double) get(key);
  }

  @SuppressWarnings("unchecked")
  public List<String> getList(String key) {
    return (List<String>) get(key);
  }

  public Boolean getBoolean(String key) {
    return (Boolean) get(key);
  }

  public String getString(String key) {
    return (String) get(key);
  }

  public Class<?> getClass(String key) {
    return (Class<?>) get(key);
  }

  /**
   * @return Original configs supplied but never requested.
   */
  public Set<String> unused() {
    Set<String> keys = new HashSet<>(_originals.keySet());
    keys.removeAll(_used);
    return keys;
  }

  /**
   * @return Original configs.
   */
  public Map<String, Object> originals() {
    return new HashMap<>(_originals);
  }

  public Map<String, ?> values() {
    return Collections.unmodifiableMap(_values);
  }

  private void logAll() {
    StringBuilder b = new StringBuilder();
    b.append(getClass().getSimpleName());
    b.append(" values: ");
    b.append(NL);

    for (Map.Entry<String, Object> entry : new TreeMap<>(_values).entrySet()) {
      b.append('\t');
      b.append(entry.getKey());
      b.append(" = ");
      b.append(entry.getValue());
      b.append(NL);
    }
    _log.info(b.toString());
  }

  /**
   * Log warnings for any unused configurations
   */
  public void logUnused() {
    for (String key : unused()) {
      _log.warn("The configuration '{}' was supplied but isn't a known config.", key);
    }
  }

  /**
   * Get a configured instance of the class specified by the given configuration key. If the object implements
   * {@link AnomalyWatchConfigurable}, configure it using the original configuration.
   *
   * @param key The configuration key for the class.
   * @param t The interface the class should implement.
   * @param <T> The type of the configured instance to be returned.
   * @return A configured instance of the class.
   */
  public <T> T getConfiguredInstance(String key, Class<T> t) throws AnomalyWatchException {
    Class<?> c = getClass(key);
    if (c == null) {
      return null;
    }
    Object o = Utils.newInstance(c);
    if (!t.isInstance(o)) {
      throw new AnomalyWatchException(c.getName() + " is not an instance of " + t.getName());
    }
    if (o instanceof AnomalyWatchConfigurable) {
      ((AnomalyWatchConfigurable) o).configure(originals());
    }
    return t.cast(o);
  }
}
