/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalywatch.common.utils;

import com.linkedin.anomalywatch.exception.AnomalyWatchException;
import java.util.Collection;
import java.util.Iterator;


public final class Utils {

  private Utils() {

  }

  /**
   * @param c Class for which a new instance will be instantiated.
   * @param <T> The type of the instance to be returned.
   * @return Instantiated class.
   */
  public static <T> T newInstance(Class<T> c) throws AnomalyWatchException {
    if (c == null) {
      throw new AnomalyWatchException("class cannot be null");
    }
    try {
      return c.getDeclaredConstructor().newInstance();
    } catch (NoSuchMethodException e) {
      throw new AnomalyWatchException("Could not find a public no-argument constructor for " + c.getName(), e);
    } catch (ReflectiveOperationException | RuntimeException e) {
      throw new AnomalyWatchException("Could not instantiate class " + c.getName(), e);
    }
  }

  /**
   * @return The context class loader of this thread, or the class loader that loaded this library if there is none.
   */
  public static ClassLoader contextOrLibraryClassLoader() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    return cl == null ? Utils.class.getClassLoader() : cl;
  }

  /**
   * Create a string representation of a collection joined by the given separator.
   * @param items The items.
   * @param separator The separator.
   * @param <T> The type of the items.
   * @return The string representation.
   */
  public static <T> String join(Collection<T> items, String separator) {
    StringBuilder sb = new StringBuilder();
    Iterator<T> iter = items.iterator();
    while (iter.hasNext()) {
      sb.append(iter.next());
      if (iter.hasNext()) {
        sb.append(separator);
      }
    }
    return sb.toString();
  }

  /**
   * Checks that the specified object reference is not null and throws a customized {@link IllegalArgumentException}
   * if it is.
   *
   * @param obj The object reference to check for nullity.
   * @param message Detail message to be used in the event that an exception is thrown.
   * @param <T> The type of the reference.
   * @return The given object if not null.
   */
  public static <T> T validateNotNull(T obj, String message) {
    if (obj == null) {
      throw new IllegalArgumentException(message);
    }
    return obj;
  }
}
