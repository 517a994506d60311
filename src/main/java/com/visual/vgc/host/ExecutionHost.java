package com.visual.vgc.host;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;

import lombok.extern.log4j.Log4j2;

/**
 * Runs the entry method of a compiled unit and captures what it prints.
 *
 * <p>
 * {@code System.out} is process-wide, so runs are serialized on one lock for the
 * whole redirect-invoke-restore sequence. The original stream is restored on
 * every path. There is no timeout: a graph that loops forever blocks the caller
 * and every later run.
 */
@Log4j2
public final class ExecutionHost {
    private static final Object RUN_LOCK = new Object();

    /**
     * Invokes {@code entryTypeName.entryMethodName()}. An instance method is
     * called on a new instance made with the public no-argument constructor.
     * Never throws; every failure is reported through {@link RunResult#fault()}.
     */
    public RunResult run(CompiledUnit unit, String entryTypeName, String entryMethodName) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ExecutionFault fault = null;

        synchronized (RUN_LOCK) {
            PrintStream original = System.out;
            Thread thread = Thread.currentThread();
            ClassLoader originalContext = thread.getContextClassLoader();
            long t0 = System.nanoTime();
            try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
                Class<?> type = unit.loadClass(entryTypeName);
                Method method = type.getMethod(entryMethodName);
                Object target = Modifier.isStatic(method.getModifiers())
                        ? null
                        : type.getDeclaredConstructor().newInstance();

                thread.setContextClassLoader(unit.classLoader());
                System.setOut(capture);
                method.invoke(target);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                fault = ExecutionFault.of("Generated code threw " + cause.getClass().getSimpleName(), cause);
            } catch (ClassNotFoundException e) {
                fault = ExecutionFault.of("Entry type not found: " + entryTypeName);
            } catch (NoSuchMethodException e) {
                fault = ExecutionFault.of("No public no-argument method " + entryMethodName + " or constructor on "
                        + entryTypeName);
            } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
                fault = ExecutionFault.of("Could not run " + entryTypeName + "." + entryMethodName, e);
            } finally {
                System.setOut(original);
                thread.setContextClassLoader(originalContext);
                log.info("Ran {}.{} of unit '{}' in {} ms{}", entryTypeName, entryMethodName, unit.name(),
                        (System.nanoTime() - t0) / 1_000_000, fault == null ? "" : " (faulted)");
            }
        }

        if (fault != null)
            log.warn("Run of unit '{}' faulted: {}", unit.name(), fault.message());
        return new RunResult(buffer.toString(StandardCharsets.UTF_8), fault);
    }
}
