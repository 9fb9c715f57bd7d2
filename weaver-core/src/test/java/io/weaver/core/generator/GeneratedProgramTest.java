package io.weaver.core.generator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.weaver.core.Fixtures;
import io.weaver.core.WeaverFactory;
import io.weaver.runtime.RecursionDepthExceededException;
import io.weaver.runtime.WorkflowContext;
import io.weaver.runtime.WorkflowResult;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/// Compiles the generated companion class together with its source unit and runs it.
class GeneratedProgramTest {

    @TempDir Path workDir;

    private final List<URLClassLoader> loaders = new ArrayList<>();
    private Class<?> workflows;
    private Class<?> adder;

    @BeforeEach
    void compileAdder() throws Exception {
        adder = load("Adder", Fixtures.ADDER);
        workflows = adder.getClassLoader().loadClass("flows.AdderWorkflows");
    }

    @AfterEach
    void close() throws IOException {
        for (URLClassLoader loader : loaders) {
            loader.close();
        }
    }

    /// Compiles `flows.<name>` with its generated companion and loads the source unit class.
    private Class<?> load(String name, String source) throws Exception {
        String generated =
                WeaverFactory.create().compile(name + ".java", source).generatedSource();

        Path root = workDir.resolve(name);
        Path sources = Files.createDirectories(root.resolve("src/flows"));
        Path classes = Files.createDirectories(root.resolve("classes"));
        Path unit = Files.writeString(sources.resolve(name + ".java"), source);
        Path companion = Files.writeString(sources.resolve(name + "Workflows.java"), generated);
        javac(classes, List.of(unit, companion));

        URLClassLoader loader =
                new URLClassLoader(
                        new URL[] {classes.toUri().toURL()}, getClass().getClassLoader());
        loaders.add(loader);
        return loader.loadClass("flows." + name);
    }

    private static void javac(Path classes, List<Path> files) throws Exception {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        assertThat(compiler).as("JDK compiler").isNotNull();
        URL runtimeLocation =
                WorkflowResult.class.getProtectionDomain().getCodeSource().getLocation();
        Path runtime = Path.of(runtimeLocation.toURI());

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager fileManager =
                compiler.getStandardFileManager(null, null, null)) {
            Iterable<? extends JavaFileObject> units =
                    fileManager.getJavaFileObjectsFromPaths(files);
            List<String> options =
                    List.of("-classpath", runtime.toString(), "-d", classes.toString());
            boolean ok =
                    compiler.getTask(null, fileManager, diagnostics, options, null, units).call();
            assertThat(ok)
                    .as(
                            () ->
                                    diagnostics.getDiagnostics().stream()
                                            .map(d -> d.getMessage(Locale.ROOT))
                                            .collect(Collectors.joining("\n")))
                    .isTrue();
        }
    }

    private static Object invoke(Class<?> companion, String workflow, Map<String, Object> params)
            throws Exception {
        Method entry = companion.getMethod(workflow, boolean.class, Map.class);
        return entry.invoke(null, true, params);
    }

    private WorkflowResult run(String workflow, Map<String, Object> params) throws Exception {
        return (WorkflowResult) invoke(workflows, workflow, params);
    }

    private static int counter(Class<?> unit, String name) throws Exception {
        return ((AtomicInteger) unit.getField(name).get(null)).get();
    }

    private int counter(String name) throws Exception {
        return counter(adder, name);
    }

    @Test
    void shouldRunConjunctionNodeOnceWithBothInputs() throws Exception {
        WorkflowResult result = run("calculate", Map.of("x", 1, "y", 2));

        assertThat(counter("ADDS")).isEqualTo(1);
        assertThat(result.isOnSuccess()).isTrue();
        assertThat(result.isOnFailure()).isFalse();
        assertThat(result.get("sum")).isEqualTo(3.0);
    }

    @Test
    void shouldFireJoinedNodeOnceForTwoTriggers() throws Exception {
        WorkflowResult result = run("fork", Map.of());

        assertThat(counter("TICKS")).isEqualTo(3);
        assertThat(result.isOnSuccess()).isTrue();
    }

    @Test
    void shouldNeverRunPullNodeNobodyReads() throws Exception {
        WorkflowResult result = run("idle", Map.of());

        assertThat(counter("LAZY")).isZero();
        assertThat(result.isOnSuccess()).isTrue();
        assertThat(result.getOutputs()).containsEntry("sum", null);
    }

    @Test
    void shouldStopMutualRecursionAtDepthCeiling() throws Exception {
        Method entry =
                workflows.getMethod("ping", boolean.class, Map.class, WorkflowContext.class);
        WorkflowContext context = WorkflowContext.create();

        assertThatThrownBy(() -> entry.invoke(null, true, Map.of("sum", 1), context))
                .isInstanceOf(InvocationTargetException.class)
                .cause()
                .isInstanceOf(RecursionDepthExceededException.class);
    }

    @Nested
    class Lists {

        private Class<?> lists;
        private Class<?> companion;

        @BeforeEach
        void compileLists() throws Exception {
            lists = load("Lists", Fixtures.LISTS);
            companion = lists.getClassLoader().loadClass("flows.ListsWorkflows");
        }

        private WorkflowResult run(String workflow, Map<String, Object> params) throws Exception {
            return (WorkflowResult) invoke(companion, workflow, params);
        }

        @Test
        void shouldRunScopeBodyOncePerElement() throws Exception {
            WorkflowResult result = run("iterate", Map.of("items", List.of(1, 2, 3)));

            assertThat(result.isOnSuccess()).isTrue();
            assertThat(result.get("results")).isEqualTo(List.of(2.0, 4.0, 6.0));
            assertThat(counter(lists, "DOUBLINGS")).isEqualTo(3);
        }

        @Test
        void shouldStartEveryRunWithFreshScopeOutputs() throws Exception {
            run("iterate", Map.of("items", List.of(5)));
            WorkflowResult second = run("iterate", Map.of("items", List.of(1, 10)));

            assertThat(second.get("results")).isEqualTo(List.of(2.0, 20.0));
        }

        @Test
        void shouldIterateThroughMapLineAndRenderJson() throws Exception {
            WorkflowResult result = run("mapped", Map.of("items", List.of(1, 2, 3)));

            assertThat(result.isOnSuccess()).isTrue();
            assertThat(result.get("results")).isEqualTo(List.of(2.0, 4.0, 6.0));
            assertThat(result.get("json")).isEqualTo("[2.0,4.0,6.0]");
        }

        @Test
        void shouldCoerceNumberToText() throws Exception {
            WorkflowResult result = run("describe", Map.of("value", 10.5));

            assertThat(result.isOnSuccess()).isTrue();
            assertThat(result.get("text")).isEqualTo("21");
        }

        @Test
        void shouldReturnFutureFromAsyncWorkflow() throws Exception {
            Method entry = companion.getMethod("deferred", boolean.class, Map.class);
            assertThat(entry.getReturnType()).isEqualTo(CompletableFuture.class);

            Object future = entry.invoke(null, true, Map.of("value", 41));

            assertThat(future).isInstanceOf(CompletableFuture.class);
            Object result = ((CompletableFuture<?>) future).get(5, TimeUnit.SECONDS);
            assertThat(result).isInstanceOf(WorkflowResult.class);
            assertThat(((WorkflowResult) result).isOnSuccess()).isTrue();
            assertThat(((WorkflowResult) result).get("total")).isEqualTo(42.0);
        }
    }
}
