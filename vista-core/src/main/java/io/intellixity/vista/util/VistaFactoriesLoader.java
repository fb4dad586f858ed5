package io.intellixity.vista.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.*;

/**
 * Discovers plugin implementations listed in {@code META-INF/vista.factories}.\n
 *
 * Each resource is a properties file keyed by the SPI interface name:\n
 *
 * <pre>
 * io.intellixity.vista.spi.backend.BackendProvider=com.acme.DuckProvider,com.acme.OtherProvider
 * </pre>
 *
 * Implementations need a public no-arg constructor. Duplicates across resources are instantiated once.
 */
public final class VistaFactoriesLoader {
  public static final String RESOURCE = "META-INF/vista.factories";

  private VistaFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader loader = (cl == null) ? VistaFactoriesLoader.class.getClassLoader() : cl;

    LinkedHashSet<String> names = new LinkedHashSet<>();
    for (URL url : resources(loader)) names.addAll(implNames(url, spiType.getName()));

    List<T> out = new ArrayList<>(names.size());
    for (String implName : names) out.add(instantiate(implName, spiType, loader));
    return out;
  }

  private static List<URL> resources(ClassLoader loader) {
    try {
      return Collections.list(loader.getResources(RESOURCE));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static List<String> implNames(URL url, String key) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + url, e);
    }
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return List.of();
    List<String> out = new ArrayList<>();
    for (String part : v.split(",")) {
      String name = part.trim();
      if (!name.isEmpty()) out.add(name);
    }
    return out;
  }

  private static <T> T instantiate(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Factory class " + implName + " listed for " + spiType.getName() + " is not on the classpath", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalStateException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for " + spiType.getName(), e);
    }
  }
}
