package org.fixtureflow.runtime.metadata;

import com.google.common.collect.ImmutableList;
import java.lang.annotation.Annotation;
import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.fixtureflow.api.AssemblyCleanup;
import org.fixtureflow.api.AssemblyInitialize;
import org.fixtureflow.api.ClassCleanup;
import org.fixtureflow.api.ClassCleanupBehavior;
import org.fixtureflow.api.ClassInitialize;
import org.fixtureflow.api.DoNotParallelize;
import org.fixtureflow.api.DynamicData;
import org.fixtureflow.api.ExpectedException;
import org.fixtureflow.api.GlobalTestCleanup;
import org.fixtureflow.api.GlobalTestInitialize;
import org.fixtureflow.api.Ignore;
import org.fixtureflow.api.InheritanceBehavior;
import org.fixtureflow.api.Retry;
import org.fixtureflow.api.TestCleanup;
import org.fixtureflow.api.TestContext;
import org.fixtureflow.api.TestInitialize;
import org.fixtureflow.api.TestMethod;
import org.fixtureflow.api.Timeout;
import org.fixtureflow.runtime.ExecutionSettings;
import org.fixtureflow.runtime.exceptions.TypeInspectionException;
import org.fixtureflow.runtime.model.TestElement;
import org.fixtureflow.runtime.model.TestSource;
import org.fixtureflow.runtime.retry.AttemptBasedRetryPolicy;

/**
 * Resolves sources, classes and test methods into descriptors.
 *
 * <p>The first resolution of an identifier inspects the type through reflection and caches
 * the descriptor; later resolutions return the cached one. A resolution failing with
 * {@link TypeInspectionException} caches nothing, so every test of a malformed class reports
 * the same error.
 *
 * <p>One cache belongs to one run. It is safe for concurrent use.
 */
@Slf4j
public class MetadataCache {

    private static final String INIT_SIGNATURE = "The method must be static, public, does not "
            + "return a value and should take a single parameter of type TestContext.";

    private static final String CLEANUP_SIGNATURE = "The method must be static, public, does "
            + "not return a value and should take no parameter or a single parameter of type "
            + "TestContext.";

    private static final String TEST_SIGNATURE = "The method must be non-static, public, does "
            + "not return a value and should not take any parameter.";

    private final ExecutionSettings settings;

    private final Map<String, AssemblyDescriptor> assemblies = new ConcurrentHashMap<>();

    private final Map<String, ClassDescriptor> classes = new ConcurrentHashMap<>();

    private final Map<String, TestMethodDescriptor> methods = new ConcurrentHashMap<>();

    /** Classes per source, in the order they were first resolved. */
    private final Map<String, Queue<ClassDescriptor>> resolvedBySource = new ConcurrentHashMap<>();

    public MetadataCache(@Nonnull ExecutionSettings settings) {
        this.settings = settings;
    }

    @Nonnull
    public AssemblyDescriptor resolveAssembly(@Nonnull TestSource source) {
        return assemblies.computeIfAbsent(source.getId(), id -> inspectAssembly(source));
    }

    @Nonnull
    public ClassDescriptor resolveClass(@Nonnull TestSource source, @Nonnull String className) {
        ClassDescriptor cached = classes.get(key(source.getId(), className));
        if (cached != null) {
            return cached;
        }
        AssemblyDescriptor assembly = resolveAssembly(source);
        return classes.computeIfAbsent(key(source.getId(), className), k -> {
            ClassDescriptor descriptor = inspectClass(assembly, loadClass(source, className)
                    .orElseThrow(() -> new TypeInspectionException(
                            "Unable to load type " + className + " from source "
                                    + source.getId() + ".")));
            resolvedBySource.computeIfAbsent(source.getId(), id -> new ConcurrentLinkedQueue<>())
                    .add(descriptor);
            return descriptor;
        });
    }

    /**
     * Resolved classes of the source with an executable class cleanup, own or inherited, in
     * resolution order. Classes never resolved are not listed.
     */
    @Nonnull
    public List<ClassDescriptor> classesWithCleanup(@Nonnull TestSource source) {
        Queue<ClassDescriptor> resolved = resolvedBySource.get(source.getId());
        if (resolved == null) {
            return ImmutableList.of();
        }
        return resolved.stream()
                .filter(ClassDescriptor::hasExecutableCleanup)
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Resolves the method an element refers to.
     *
     * @return {@code null} when the class or the method no longer exists
     */
    @Nullable
    public TestMethodDescriptor resolveMethod(@Nonnull TestSource source,
                                              @Nonnull TestElement element) {
        String key = key(source.getId(), element.getClassName() + "#" + element.getMethodName());
        TestMethodDescriptor cached = methods.get(key);
        if (cached != null) {
            return cached;
        }
        if (!loadClass(source, element.getClassName()).isPresent()) {
            return null;
        }
        ClassDescriptor classDescriptor = resolveClass(source, element.getClassName());
        return methods.computeIfAbsent(key,
                k -> findTestMethod(classDescriptor.getType(), element.getMethodName())
                        .map(m -> inspectMethod(classDescriptor, m))
                        .orElse(null));
    }

    private AssemblyDescriptor inspectAssembly(TestSource source) {
        log.debug("inspectAssembly: {}", source.getId());
        List<Method> initialize = new ArrayList<>();
        List<Method> cleanup = new ArrayList<>();
        ImmutableList.Builder<Method> globalInitialize = ImmutableList.builder();
        ImmutableList.Builder<Method> globalCleanup = ImmutableList.builder();

        for (String className : source.getClassNames()) {
            Class<?> type = loadClass(source, className)
                    .orElseThrow(() -> new TypeInspectionException("Unable to load type "
                            + className + " from source " + source.getId() + "."));
            for (Method method : type.getDeclaredMethods()) {
                if (method.isAnnotationPresent(AssemblyInitialize.class)) {
                    validateStatic(method, true);
                    initialize.add(method);
                }
                if (method.isAnnotationPresent(AssemblyCleanup.class)) {
                    validateStatic(method, false);
                    cleanup.add(method);
                }
                if (method.isAnnotationPresent(GlobalTestInitialize.class)) {
                    validateStatic(method, true);
                    globalInitialize.add(accessible(method));
                }
                if (method.isAnnotationPresent(GlobalTestCleanup.class)) {
                    validateStatic(method, true);
                    globalCleanup.add(accessible(method));
                }
            }
        }

        return AssemblyDescriptor.builder()
                .source(source)
                .assemblyInitialize(single(initialize, AssemblyInitialize.class, source.getId()))
                .assemblyCleanup(single(cleanup, AssemblyCleanup.class, source.getId()))
                .globalTestInitialize(globalInitialize.build())
                .globalTestCleanup(globalCleanup.build())
                .build();
    }

    private ClassDescriptor inspectClass(AssemblyDescriptor assembly, Class<?> type) {
        log.debug("inspectClass: {}", type.getName());

        FixtureMethod classInitialize = ownFixture(type, ClassInitialize.class, true);
        FixtureMethod classCleanup = ownFixture(type, ClassCleanup.class, false);

        // Walking up collects base fixtures derived first. Initialize runs them base first.
        List<FixtureMethod> baseInitialize = new ArrayList<>();
        List<FixtureMethod> baseCleanup = new ArrayList<>();
        ClassCleanupBehavior behavior = cleanupBehavior(classCleanup);
        for (Class<?> base = type.getSuperclass(); base != null && base != Object.class;
             base = base.getSuperclass()) {
            FixtureMethod init = ownFixture(base, ClassInitialize.class, true);
            if (init != null && init.getMethod().getAnnotation(ClassInitialize.class)
                    .inheritance() == InheritanceBehavior.BEFORE_EACH_DERIVED_CLASS) {
                baseInitialize.add(init);
            }
            FixtureMethod cleanup = ownFixture(base, ClassCleanup.class, false);
            if (cleanup != null && cleanup.getMethod().getAnnotation(ClassCleanup.class)
                    .inheritance() == InheritanceBehavior.BEFORE_EACH_DERIVED_CLASS) {
                baseCleanup.add(cleanup);
                if (behavior == ClassCleanupBehavior.DEFAULT) {
                    behavior = cleanupBehavior(cleanup);
                }
            }
        }

        ImmutableList.Builder<FixtureMethod> initializeChain = ImmutableList.builder();
        initializeChain.addAll(ImmutableList.copyOf(baseInitialize).reverse());
        if (classInitialize != null) {
            initializeChain.add(classInitialize);
        }
        ImmutableList.Builder<FixtureMethod> cleanupChain = ImmutableList.builder();
        if (classCleanup != null) {
            cleanupChain.add(classCleanup);
        }
        cleanupChain.addAll(baseCleanup);

        Ignore ignore = type.getAnnotation(Ignore.class);
        return ClassDescriptor.builder()
                .parent(assembly)
                .type(type)
                .constructor(findConstructor(type))
                .contextSetter(findContextSetter(type))
                .initializeChain(initializeChain.build())
                .cleanupChain(cleanupChain.build())
                .testInitialize(perTestChain(type, TestInitialize.class).reverse())
                .testCleanup(perTestChain(type, TestCleanup.class))
                .declaredCleanupBehavior(behavior)
                .ignored(ignore != null)
                .ignoreMessage(ignore != null ? ignore.value() : null)
                .doNotParallelize(type.isAnnotationPresent(DoNotParallelize.class))
                .build();
    }

    private TestMethodDescriptor inspectMethod(ClassDescriptor parent, Method method) {
        TestMethodDescriptor.TestMethodDescriptorBuilder builder = TestMethodDescriptor.builder()
                .parent(parent)
                .method(accessible(method))
                .doNotParallelize(parent.isDoNotParallelize()
                        || method.isAnnotationPresent(DoNotParallelize.class));

        Ignore ignore = method.getAnnotation(Ignore.class);
        if (ignore != null) {
            builder.ignored(true).ignoreMessage(ignore.value());
        } else if (parent.isIgnored()) {
            builder.ignored(true).ignoreMessage(parent.getIgnoreMessage());
        }

        Timeout timeout = method.getAnnotation(Timeout.class);
        if (timeout != null && timeout.value() <= 0) {
            return builder.notRunnableReason("Method " + parent.getClassName() + "."
                    + method.getName() + " has an invalid timeout. The timeout must be "
                    + "greater than 0.").build();
        }
        builder.timeout(TimeoutInfo.of(timeout, settings.getDefaultTestTimeout(),
                settings.isCooperativeCancellation()));

        Retry retry = method.getAnnotation(Retry.class);
        if (retry != null) {
            if (retry.maxAttempts() < 1 || retry.delay() < 0) {
                return builder.notRunnableReason("Method " + parent.getClassName() + "."
                        + method.getName() + " declares an invalid retry: maxAttempts must be "
                        + "at least 1 and delay must not be negative.").build();
            }
            builder.retryPolicy(AttemptBasedRetryPolicy.of(retry));
        }

        ExpectedException expected = method.getAnnotation(ExpectedException.class);
        if (expected != null) {
            builder.expectedException(TypeExpectedExceptionVerifier.of(expected));
        }

        DynamicData data = method.getAnnotation(DynamicData.class);
        boolean signatureOk = Modifier.isPublic(method.getModifiers())
                && !Modifier.isStatic(method.getModifiers())
                && !Modifier.isAbstract(method.getModifiers())
                && method.getReturnType() == void.class
                && (data != null || method.getParameterCount() == 0);
        if (!signatureOk) {
            return builder.notRunnableReason("Method " + parent.getClassName() + "."
                    + method.getName() + " has wrong signature. " + TEST_SIGNATURE).build();
        }

        if (data != null) {
            Optional<Method> source = findDataSource(parent.getType(), data.value());
            if (!source.isPresent()) {
                return builder.notRunnableReason("Data source method " + data.value()
                        + " of " + parent.getClassName() + "." + method.getName()
                        + " was not found. It must be static, take no parameter and return "
                        + "Iterable<Object[]>.").build();
            }
            builder.dataSource(source.get());
        }
        return builder.build();
    }

    /**
     * Test classes are often nested or package-private; their public members are still
     * meant to be invoked.
     */
    private static <T extends AccessibleObject> T accessible(T member) {
        member.setAccessible(true);
        return member;
    }

    @Nullable
    private FixtureMethod ownFixture(Class<?> type, Class<? extends Annotation> annotation,
                                     boolean initialize) {
        List<Method> found = Arrays.stream(type.getDeclaredMethods())
                .filter(m -> m.isAnnotationPresent(annotation))
                .collect(Collectors.toList());
        if (found.size() > 1) {
            throw new TypeInspectionException("The type " + type.getName()
                    + " has more than one method marked with @" + annotation.getSimpleName()
                    + ". Only one is allowed.");
        }
        if (found.isEmpty()) {
            return null;
        }
        Method method = found.get(0);
        validateStatic(method, initialize);
        return fixture(method);
    }

    @Nullable
    private FixtureMethod single(List<Method> found, Class<? extends Annotation> annotation,
                                 String sourceId) {
        if (found.size() > 1) {
            throw new TypeInspectionException("The source " + sourceId
                    + " has more than one method marked with @" + annotation.getSimpleName()
                    + ": " + found.stream()
                    .map(m -> m.getDeclaringClass().getName() + "." + m.getName())
                    .collect(Collectors.joining(", ")) + ". Only one is allowed.");
        }
        return found.isEmpty() ? null : fixture(found.get(0));
    }

    private FixtureMethod fixture(Method method) {
        Timeout timeout = method.getAnnotation(Timeout.class);
        if (timeout != null && timeout.value() <= 0) {
            throw new TypeInspectionException("Method " + method.getDeclaringClass().getName()
                    + "." + method.getName() + " has an invalid timeout. The timeout must be "
                    + "greater than 0.");
        }
        return new FixtureMethod(accessible(method), TimeoutInfo.of(timeout,
                settings.getDefaultFixtureTimeout(), settings.isCooperativeCancellation()));
    }

    /**
     * Per-test initialize or cleanup methods of the hierarchy, the class's own first. A base
     * method overridden further down is skipped: invoking it would dispatch to the override.
     */
    private ImmutableList<Method> perTestChain(Class<?> type,
                                               Class<? extends Annotation> annotation) {
        ImmutableList.Builder<Method> chain = ImmutableList.builder();
        Set<String> seen = new HashSet<>();
        for (Class<?> current = type; current != null && current != Object.class;
             current = current.getSuperclass()) {
            List<Method> found = new ArrayList<>();
            for (Method method : current.getDeclaredMethods()) {
                if (!method.isAnnotationPresent(annotation)) {
                    continue;
                }
                if (Modifier.isStatic(method.getModifiers())
                        || !Modifier.isPublic(method.getModifiers())
                        || method.getReturnType() != void.class
                        || method.getParameterCount() != 0) {
                    throw new TypeInspectionException("Method " + current.getName() + "."
                            + method.getName() + " has wrong signature. " + TEST_SIGNATURE);
                }
                found.add(method);
            }
            if (found.size() > 1) {
                throw new TypeInspectionException("The type " + current.getName()
                        + " has more than one method marked with @"
                        + annotation.getSimpleName() + ". Only one is allowed.");
            }
            for (Method method : found) {
                if (seen.add(method.getName())) {
                    chain.add(accessible(method));
                }
            }
            for (Method method : current.getDeclaredMethods()) {
                if (method.getParameterCount() == 0 && !Modifier.isStatic(method.getModifiers())) {
                    seen.add(method.getName());
                }
            }
        }
        return chain.build();
    }

    private static void validateStatic(Method method, boolean initialize) {
        int modifiers = method.getModifiers();
        Class<?>[] parameters = method.getParameterTypes();
        boolean parametersOk = initialize
                ? parameters.length == 1 && parameters[0] == TestContext.class
                : parameters.length == 0
                || (parameters.length == 1 && parameters[0] == TestContext.class);
        if (!Modifier.isStatic(modifiers) || !Modifier.isPublic(modifiers)
                || method.getReturnType() != void.class || !parametersOk) {
            throw new TypeInspectionException("Method " + method.getDeclaringClass().getName()
                    + "." + method.getName() + " has wrong signature. "
                    + (initialize ? INIT_SIGNATURE : CLEANUP_SIGNATURE));
        }
    }

    private static ClassCleanupBehavior cleanupBehavior(@Nullable FixtureMethod cleanup) {
        if (cleanup == null) {
            return ClassCleanupBehavior.DEFAULT;
        }
        return cleanup.getMethod().getAnnotation(ClassCleanup.class).behavior();
    }

    private static Constructor<?> findConstructor(Class<?> type) {
        Constructor<?> withContext = null;
        for (Constructor<?> constructor : type.getConstructors()) {
            Class<?>[] parameters = constructor.getParameterTypes();
            if (parameters.length == 0) {
                return accessible(constructor);
            }
            if (parameters.length == 1 && parameters[0] == TestContext.class) {
                withContext = constructor;
            }
        }
        if (withContext == null) {
            throw new TypeInspectionException("Cannot find a valid constructor for test class "
                    + type.getName() + ". Valid constructors are public and either "
                    + "parameterless or with one parameter of type TestContext.");
        }
        return accessible(withContext);
    }

    @Nullable
    private static Method findContextSetter(Class<?> type) {
        try {
            return accessible(type.getMethod("setTestContext", TestContext.class));
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    /**
     * Public method of that name, preferring the one marked {@link TestMethod} when the name
     * is overloaded.
     */
    private static Optional<Method> findTestMethod(Class<?> type, String name) {
        List<Method> candidates = Arrays.stream(type.getMethods())
                .filter(m -> m.getName().equals(name))
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            // non-public methods still resolve, and are then reported as not runnable
            for (Class<?> current = type; current != null; current = current.getSuperclass()) {
                for (Method method : current.getDeclaredMethods()) {
                    if (method.getName().equals(name)) {
                        return Optional.of(method);
                    }
                }
            }
            return Optional.empty();
        }
        return Optional.of(candidates.stream()
                .filter(m -> m.isAnnotationPresent(TestMethod.class))
                .findFirst()
                .orElse(candidates.get(0)));
    }

    private static Optional<Method> findDataSource(Class<?> type, String name) {
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            for (Method method : current.getDeclaredMethods()) {
                if (method.getName().equals(name) && method.getParameterCount() == 0
                        && Modifier.isStatic(method.getModifiers())
                        && Iterable.class.isAssignableFrom(method.getReturnType())) {
                    method.setAccessible(true);
                    return Optional.of(method);
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Class<?>> loadClass(TestSource source, String className) {
        try {
            return Optional.of(Class.forName(className, false, source.getClassLoader()));
        } catch (ClassNotFoundException | LinkageError e) {
            log.debug("loadClass: {} not found in {}", className, source.getId());
            return Optional.empty();
        }
    }

    private static String key(String sourceId, String name) {
        return sourceId + "::" + name;
    }
}
