package com.tyron.keystone.core.discovery;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Known implementations per abstract type, populated at startup.
 * <p>
 * Entries come from explicit {@link #add} calls and, lazily per type, from the
 * {@code META-INF/services/<type>} provider-configuration files used by
 * {@link java.util.ServiceLoader}. Providers are loaded without being initialized or
 * instantiated.
 */
public final class ImplementationCatalog {

    private static final Logger LOG = Logger.getLogger(ImplementationCatalog.class.getName());

    private static final String SERVICES_PREFIX = "META-INF/services/";

    private final ClassLoader classLoader;
    private final boolean readProviderFiles;

    private final Map<Class<?>, Set<Class<?>>> explicit = new ConcurrentHashMap<>();
    private final Map<Class<?>, List<Class<?>>> fromProviderFiles = new ConcurrentHashMap<>();

    private ImplementationCatalog(ClassLoader classLoader, boolean readProviderFiles) {
        this.classLoader = classLoader;
        this.readProviderFiles = readProviderFiles;
    }

    /**
     * A catalog that also consults provider-configuration files visible to the class loader.
     */
    public static ImplementationCatalog fromServiceFiles(ClassLoader classLoader) {
        return new ImplementationCatalog(Objects.requireNonNull(classLoader, "classLoader"), true);
    }

    /**
     * A catalog that only knows what is {@link #add added} explicitly.
     */
    public static ImplementationCatalog empty() {
        return new ImplementationCatalog(ImplementationCatalog.class.getClassLoader(), false);
    }

    public <T> ImplementationCatalog add(Class<T> abstractType, Class<? extends T> implementation) {
        Objects.requireNonNull(abstractType, "abstractType");
        Objects.requireNonNull(implementation, "implementation");
        explicit.computeIfAbsent(abstractType, k -> Collections.synchronizedSet(new LinkedHashSet<>()))
                .add(implementation);
        return this;
    }

    /**
     * @return candidates in declaration order: explicit additions first, then provider files.
     */
    public List<Class<?>> candidatesFor(Class<?> abstractType) {
        List<Class<?>> result = new ArrayList<>();
        Set<Class<?>> added = explicit.get(abstractType);
        if (added != null) {
            synchronized (added) {
                result.addAll(added);
            }
        }
        if (readProviderFiles) {
            for (Class<?> c : fromProviderFiles.computeIfAbsent(abstractType, this::readProviderFiles)) {
                if (!result.contains(c)) {
                    result.add(c);
                }
            }
        }
        return result;
    }

    private List<Class<?>> readProviderFiles(Class<?> abstractType) {
        List<Class<?>> found = new ArrayList<>();
        Enumeration<URL> urls;
        try {
            urls = classLoader.getResources(SERVICES_PREFIX + abstractType.getName());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list provider files for " + abstractType.getName(), e);
        }

        while (urls.hasMoreElements()) {
            URL url = urls.nextElement();
            for (String name : readProviderNames(url)) {
                try {
                    found.add(Class.forName(name, false, classLoader));
                } catch (ClassNotFoundException | LinkageError e) {
                    LOG.log(Level.WARNING, "Provider " + name + " listed in " + url + " cannot be loaded", e);
                }
            }
        }
        return Collections.unmodifiableList(found);
    }

    private static List<String> readProviderNames(URL url) {
        List<String> names = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(url.openStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                int comment = line.indexOf('#');
                if (comment >= 0) {
                    line = line.substring(0, comment);
                }
                line = line.trim();
                if (!line.isEmpty() && !names.contains(line)) {
                    names.add(line);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read provider file " + url, e);
        }
        return names;
    }
}
