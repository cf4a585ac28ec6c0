/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.dbsuite.doccat.runtime;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Proxy;
import java.lang.reflect.Type;
import java.text.Format;
import java.text.MessageFormat;
import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Wrapper classes around message resources that let the compiler check
 * that each message exists and that its uses pass the right number and
 * types of arguments.
 *
 * <p>A resource interface declares one method per message. Each method
 * carries a {@link BaseMessage} and returns an {@link Inst} (a formatted
 * message), an {@link ExInst} or an {@link ExInstWithCause} (a factory for
 * an exception of a given class). {@link #create(Class)} implements the
 * interface with a dynamic proxy backed by a resource bundle of the same
 * name.
 */
public class Resources {
  private Resources() {}

  /** Creates an instance of a resource interface, using the interface's
   * name as the base name of the resource bundle.
   *
   * @param <T> Resource type
   * @param clazz Interface that contains a method for each resource
   * @return Instance of the interface
   */
  public static <T> T create(Class<T> clazz) {
    return create(clazz.getCanonicalName(), clazz);
  }

  /** Creates an instance of a resource interface backed by the resource
   * bundle {@code base}.
   *
   * <p>Suppose that base = "com.example.MyResource". A method
   *
   * <blockquote><pre><code>
   *     &#64;BaseMessage("Table ''{0}'' not found")
   *     ExInst&lt;MyException&gt; tableNotFound(String a0);
   * </code></pre></blockquote>
   *
   * <p>looks up the key "TableNotFound" in
   * "com/example/MyResource.properties" and, if the bundle or the key is
   * missing, falls back to the base message.
   *
   * @param <T> Resource type
   * @param base Base name of the resource bundle
   * @param clazz Interface that contains a method for each resource
   * @return Instance of the interface
   */
  public static <T> T create(final String base, Class<T> clazz) {
    final Map<String, Object> cache = new ConcurrentHashMap<>();
    //noinspection unchecked
    return (T) Proxy.newProxyInstance(clazz.getClassLoader(),
        new Class[] {clazz},
        (proxy, method, args) -> {
          if (method.getDeclaringClass() == Object.class) {
            switch (method.getName()) {
            case "toString":
              return "Resources(" + base + ")";
            case "hashCode":
              return System.identityHashCode(proxy);
            case "equals":
              return args != null && proxy == args[0];
            default:
              throw new UnsupportedOperationException(method.getName());
            }
          }
          if (args == null || args.length == 0) {
            return cache.computeIfAbsent(method.getName(),
                name -> instantiate(base, method, new Object[0]));
          }
          return instantiate(base, method, args);
        });
  }

  private static Object instantiate(String base, Method method,
      @Nullable Object[] args) {
    final Class<?> returnType = method.getReturnType();
    if (!Inst.class.isAssignableFrom(returnType)) {
      throw new IllegalStateException("resource method " + method
          + " must return a sub-class of Inst");
    }
    try {
      final Constructor<?> constructor =
          returnType.getConstructor(String.class, Locale.class,
              Method.class, Object[].class);
      return constructor.newInstance(base, Locale.getDefault(), method,
          args);
    } catch (InvocationTargetException e) {
      final Throwable target = e.getTargetException();
      if (target instanceof RuntimeException) {
        throw (RuntimeException) target;
      }
      if (target instanceof Error) {
        throw (Error) target;
      }
      throw new IllegalStateException(target);
    } catch (NoSuchMethodException | InstantiationException
        | IllegalAccessException e) {
      throw new IllegalStateException("cannot create resource "
          + method.getName(), e);
    }
  }

  /** Applies all validations to all resource methods in the given
   * resource object.
   *
   * @param o Resource object to validate
   */
  public static void validate(Object o) {
    validate(o, EnumSet.allOf(Validation.class));
  }

  /** Applies the given validations to all resource methods in the given
   * resource object.
   *
   * @param o Resource object to validate
   * @param validations Validations to perform
   */
  public static void validate(Object o, EnumSet<Validation> validations) {
    int count = 0;
    for (Method method : o.getClass().getMethods()) {
      if (Modifier.isStatic(method.getModifiers())
          || !Inst.class.isAssignableFrom(method.getReturnType())) {
        continue;
      }
      ++count;
      final Class<?>[] parameterTypes = method.getParameterTypes();
      final @Nullable Object[] args = new Object[parameterTypes.length];
      for (int i = 0; i < parameterTypes.length; i++) {
        args[i] = zero(parameterTypes[i]);
      }
      try {
        final Inst inst = (Inst) method.invoke(o, args);
        if (inst == null) {
          throw new AssertionError("got null from " + method);
        }
        inst.validate(validations);
      } catch (IllegalAccessException e) {
        throw new AssertionError("in " + method, e);
      } catch (InvocationTargetException e) {
        throw new AssertionError("in " + method, e.getCause());
      }
    }
    if (count == 0 && validations.contains(Validation.AT_LEAST_ONE)) {
      throw new AssertionError("resource object " + o
          + " contains no resources");
    }
  }

  private static @Nullable Object zero(Class<?> clazz) {
    return clazz == String.class ? ""
        : clazz == int.class ? 0
        : clazz == long.class ? 0L
        : clazz == boolean.class ? false
        : null;
  }

  /** Resource instance: the method that identifies the resource, the
   * locale to render it in, and the arguments. */
  public static class Inst {
    protected final String base;
    protected final Locale locale;
    protected final Method method;
    protected final @Nullable Object[] args;
    protected final String key;

    public Inst(String base, Locale locale, Method method,
        @Nullable Object... args) {
      this.base = base;
      this.locale = locale;
      this.method = method;
      this.args = args;
      this.key = Character.toUpperCase(method.getName().charAt(0))
          + method.getName().substring(1);
    }

    @Override public boolean equals(@Nullable Object obj) {
      return this == obj
          || obj != null
          && obj.getClass() == this.getClass()
          && locale.equals(((Inst) obj).locale)
          && method.equals(((Inst) obj).method)
          && Arrays.equals(args, ((Inst) obj).args);
    }

    @Override public int hashCode() {
      return Objects.hash(locale, method, Arrays.asList(args));
    }

    public ResourceBundle bundle() {
      return ResourceBundle.getBundle(base, locale);
    }

    /** Returns the message with its arguments substituted. */
    public String str() {
      final MessageFormat format = new MessageFormat(raw(), locale);
      return format.format(args);
    }

    /** Returns the message template, from the bundle if it has one, else
     * from the {@link BaseMessage} annotation. */
    public String raw() {
      try {
        return bundle().getString(key);
      } catch (MissingResourceException e) {
        return baseMessage();
      }
    }

    private String baseMessage() {
      return requireNonNull(method.getAnnotation(BaseMessage.class),
          () -> "@BaseMessage is missing for resource '" + method.getName()
              + "'").value();
    }

    public void validate(EnumSet<Validation> validations) {
      for (Validation validation : validations) {
        switch (validation) {
        case BUNDLE_HAS_RESOURCE:
          if (!bundle().containsKey(key)) {
            throw new AssertionError("key '" + key
                + "' not found for resource '" + method.getName()
                + "'; add the following line to " + base
                + ".properties:\n" + key + '=' + baseMessage() + "\n");
          }
          break;
        case MESSAGE_SPECIFIED:
          if (method.getAnnotation(BaseMessage.class) == null) {
            throw new AssertionError("resource '" + method.getName()
                + "' must specify BaseMessage");
          }
          break;
        case EVEN_QUOTES:
          if (countQuotes(baseMessage()) % 2 == 1) {
            throw new AssertionError("resource '" + method.getName()
                + "' should have even number of quotes");
          }
          break;
        case MESSAGE_MATCH:
          final ResourceBundle bundle = bundle();
          if (bundle.containsKey(key)
              && !bundle.getString(key).equals(baseMessage())) {
            throw new AssertionError("message for resource '"
                + method.getName()
                + "' is different between class and resource file");
          }
          break;
        case ARGUMENT_MATCH:
          final @Nullable Format[] formats =
              new MessageFormat(raw()).getFormatsByArgumentIndex();
          final List<Class<?>> expected = new ArrayList<>();
          final Class<?>[] parameterTypes = method.getParameterTypes();
          for (int i = 0; i < formats.length; i++) {
            expected.add(formats[i] instanceof NumberFormat
                ? parameterTypes[i]
                : String.class);
          }
          if (!expected.equals(Arrays.asList(parameterTypes))) {
            throw new AssertionError("type mismatch in method '"
                + method.getName() + "' between message format elements "
                + expected + " and method parameters "
                + Arrays.asList(parameterTypes));
          }
          break;
        default:
          break;
        }
      }
    }

    private static int countQuotes(String message) {
      int count = 0;
      for (int i = 0; i < message.length(); i++) {
        if (message.charAt(i) == '\'') {
          ++count;
        }
      }
      return count;
    }
  }

  /** Sub-class of {@link Inst} that creates an exception with a cause.
   *
   * @param <T> Exception type */
  public static class ExInstWithCause<T extends Exception> extends Inst {
    public ExInstWithCause(String base, Locale locale, Method method,
        @Nullable Object... args) {
      super(base, locale, method, args);
    }

    public T ex(@Nullable Throwable cause) {
      final Class<T> exceptionClass =
          exceptionClass(method.getGenericReturnType());
      try {
        final Constructor<T> constructor =
            exceptionClass.getConstructor(String.class, Throwable.class);
        return constructor.newInstance(str(), cause);
      } catch (InvocationTargetException e) {
        final Throwable target = e.getTargetException();
        if (target instanceof RuntimeException) {
          throw (RuntimeException) target;
        }
        throw new IllegalStateException(target);
      } catch (NoSuchMethodException | InstantiationException
          | IllegalAccessException e) {
        throw new IllegalStateException("exception class " + exceptionClass
            + " needs a public (String, Throwable) constructor", e);
      }
    }

    /** Returns the exception class from the type argument of
     * {@code ExInstWithCause<E>} (or {@code ExInst<E>}). */
    @SuppressWarnings("unchecked")
    static <T> Class<T> exceptionClass(Type type) {
      if (type instanceof ParameterizedType) {
        final Type[] types =
            ((ParameterizedType) type).getActualTypeArguments();
        if (types.length == 1
            && types[0] instanceof Class
            && Throwable.class.isAssignableFrom((Class<?>) types[0])) {
          return (Class<T>) types[0];
        }
      }
      throw new IllegalStateException(
          "Unable to find exception type argument in " + type);
    }

    @Override public void validate(EnumSet<Validation> validations) {
      super.validate(validations);
      if (validations.contains(Validation.CREATE_EXCEPTION)) {
        final Exception e = ex(new NullPointerException("test"));
        if (e == null || !e.getMessage().equals(str())) {
          throw new AssertionError("error instantiating exception for "
              + "resource '" + method.getName() + "'");
        }
      }
    }
  }

  /** Sub-class of {@link Inst} that creates an exception without a cause.
   *
   * @param <T> Exception type */
  public static class ExInst<T extends Exception> extends ExInstWithCause<T> {
    public ExInst(String base, Locale locale, Method method,
        @Nullable Object... args) {
      super(base, locale, method, args);
    }

    public T ex() {
      return ex(null);
    }
  }

  /** Types of validation that can be performed on a resource. */
  public enum Validation {
    /** Checks that each method's resource key corresponds to a resource in
     * the bundle. */
    BUNDLE_HAS_RESOURCE,

    /** Checks that there is at least one resource in the bundle. */
    AT_LEAST_ONE,

    /** Checks that the base message annotation is on every resource. */
    MESSAGE_SPECIFIED,

    /** Checks that every message contains even number of quotes. */
    EVEN_QUOTES,

    /** Checks that the base message matches the message in the bundle. */
    MESSAGE_MATCH,

    /** Checks that it is possible to create an exception. */
    CREATE_EXCEPTION,

    /** Checks that the parameters of the method are consistent with the
     * format elements in the base message. */
    ARGUMENT_MATCH,
  }

  /** The message in the default locale. */
  @Retention(RetentionPolicy.RUNTIME)
  @Target(ElementType.METHOD)
  public @interface BaseMessage {
    String value();
  }
}
