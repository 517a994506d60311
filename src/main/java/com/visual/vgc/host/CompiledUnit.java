package com.visual.vgc.host;

import com.visual.vgc.api.OutputKind;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Compiled classes of one unit, loaded through a class loader of their own.
 *
 * <p>
 * Closing the unit closes that loader. Classes already handed out stay usable
 * until they become unreachable, at which point the loader and everything it
 * defined can be collected. Units from separate compilations never share a
 * loader, so the same class name may be compiled again at any time.
 */
@Log4j2
public final class CompiledUnit implements AutoCloseable {
    private final String name;
    private final String mainClassName;
    private final OutputKind outputKind;
    private final Map<String, byte[]> classes;
    private final String sourceText;
    private volatile UnitClassLoader loader;

    CompiledUnit(String name, String mainClassName, OutputKind outputKind, Map<String, byte[]> classes,
            String sourceText, URL[] references, ClassLoader parent) {
        this.name = name;
        this.mainClassName = mainClassName;
        this.outputKind = outputKind;
        this.classes = Map.copyOf(classes);
        this.sourceText = sourceText;
        this.loader = new UnitClassLoader(name, this.classes, references, parent);
    }

    public String name() {
        return name;
    }

    /** The public class of the compiled source, or null if it declared none. */
    public String mainClassName() {
        return mainClassName;
    }

    public OutputKind outputKind() {
        return outputKind;
    }

    /** Binary class name to class file bytes. */
    public Map<String, byte[]> classFiles() {
        return classes;
    }

    public String sourceText() {
        return sourceText;
    }

    public boolean isLoaded() {
        return loader != null;
    }

    /**
     * @throws IllegalStateException  if the unit was unloaded
     * @throws ClassNotFoundException if neither the unit nor its references define
     *                                the class
     */
    public Class<?> loadClass(String className) throws ClassNotFoundException {
        UnitClassLoader l = loader;
        if (l == null)
            throw new IllegalStateException("Unit '" + name + "' has been unloaded");
        return l.loadClass(className);
    }

    ClassLoader classLoader() {
        UnitClassLoader l = loader;
        if (l == null)
            throw new IllegalStateException("Unit '" + name + "' has been unloaded");
        return l;
    }

    /** Releases the class loader. Safe to call more than once. */
    public synchronized void unload() {
        UnitClassLoader l = loader;
        if (l == null)
            return;
        loader = null;
        try {
            l.close();
        } catch (IOException e) {
            log.warn("Closing class loader of unit '{}' failed: {}", name, e.getMessage());
        }
        log.info("Unloaded unit '{}'", name);
    }

    @Override
    public void close() {
        unload();
    }

    /** Defines the unit's classes from memory, then falls back to the reference jars. */
    private static final class UnitClassLoader extends URLClassLoader {
        private final Map<String, byte[]> classes;

        UnitClassLoader(String name, Map<String, byte[]> classes, URL[] references, ClassLoader parent) {
            super("vgc-unit-" + name, references, parent);
            this.classes = classes;
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            byte[] bytes = classes.get(name);
            if (bytes != null)
                return defineClass(name, bytes, 0, bytes.length);
            return super.findClass(name);
        }
    }
}
