package com.schemaid.behavior;

import com.schemaid.hash.Digests;
import com.schemaid.model.BehaviorHandle;
import com.schemaid.model.BehaviorRef;
import com.schemaid.model.FingerprintStrategy;
import com.schemaid.model.SchemaGraph;
import com.schemaid.model.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns attached validators and serializers into portable {@link BehaviorRef}s.
 *
 * <p>Strategies are tried strongest first:</p>
 * <ol>
 *   <li>{@code BY_NAME} for methods and classes with a stable binary name;</li>
 *   <li>{@code BY_SOURCE_HASH} for anonymous and local classes, hashing their compiled class
 *       definition;</li>
 *   <li>{@code BY_SIGNATURE} for lambdas and method references (hidden classes) or when class
 *       bytes cannot be read.</li>
 * </ol>
 *
 * <p>Resolution never fails. Every fallback past {@code BY_NAME} is reported to the listener.</p>
 */
public class BehaviorFingerprintResolver {

    private static final Logger log = LoggerFactory.getLogger(BehaviorFingerprintResolver.class);

    private final BehaviorResolutionListener listener;

    public BehaviorFingerprintResolver() {
        this(new Slf4jBehaviorResolutionListener());
    }

    public BehaviorFingerprintResolver(BehaviorResolutionListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Resolves the behaviors of every node in the graph and stores the refs on the nodes.
     *
     * @return number of refs that needed a weaker strategy than {@code BY_NAME}
     */
    public int annotate(SchemaGraph graph) {
        int degraded = 0;
        for (SchemaNode node : graph.getNodes()) {
            List<BehaviorRef> refs = new ArrayList<>(node.getBehaviors().size());
            for (BehaviorHandle handle : node.getBehaviors()) {
                BehaviorRef ref = resolve(handle, node.getOrigin());
                if (ref.isDegraded()) {
                    degraded++;
                }
                refs.add(ref);
            }
            node.setBehaviorRefs(refs);
        }
        return degraded;
    }

    public BehaviorRef resolve(BehaviorHandle handle, String origin) {
        switch (handle.getForm()) {
            case METHOD:
                return resolveMethod(handle, (Method) handle.getImplementation(), origin);
            case CLASS:
                return resolveClass(handle, (Class<?>) handle.getImplementation(), origin);
            case FUNCTION:
            default:
                return resolveClass(handle, handle.getImplementation().getClass(), origin);
        }
    }

    private BehaviorRef resolveMethod(BehaviorHandle handle, Method method, String origin) {
        Class<?> owner = method.getDeclaringClass();
        String name = owner.getName() + "#" + method.getName() + parameterList(method.getParameterTypes());

        if (isNamed(owner) && !method.isSynthetic()) {
            return ref(handle, name, FingerprintStrategy.BY_NAME, name);
        }

        byte[] classBytes = isAnonymousOrLocal(owner) ? readClassBytes(owner) : null;
        if (classBytes != null) {
            MessageDigest digest = Digests.newDigest(Digests.SHA_256);
            digest.update(classBytes);
            digest.update((method.getName() + parameterList(method.getParameterTypes())).getBytes(StandardCharsets.UTF_8));
            return degraded(handle, name, FingerprintStrategy.BY_SOURCE_HASH, digest.digest(), origin,
                    "declared in anonymous or local class " + owner.getName());
        }

        String signature = parameterList(method.getParameterTypes()) + method.getReturnType().getName();
        return degraded(handle, name, FingerprintStrategy.BY_SIGNATURE, utf8(signature), origin,
                "declaring class " + owner.getName() + " has no stable name or readable class file");
    }

    private BehaviorRef resolveClass(BehaviorHandle handle, Class<?> type, String origin) {
        String name = type.getName();

        if (isNamed(type)) {
            return ref(handle, name, FingerprintStrategy.BY_NAME, name);
        }

        byte[] classBytes = isAnonymousOrLocal(type) ? readClassBytes(type) : null;
        if (classBytes != null) {
            return degraded(handle, name, FingerprintStrategy.BY_SOURCE_HASH, Digests.sha256(classBytes), origin,
                    "anonymous or local class");
        }

        return degraded(handle, name, FingerprintStrategy.BY_SIGNATURE, utf8(functionalSignature(type)), origin,
                type.isHidden() ? "lambda or method reference" : "class file not readable");
    }

    private BehaviorRef ref(BehaviorHandle handle, String name, FingerprintStrategy strategy, String payload) {
        return new BehaviorRef(handle.getKind(), name, strategy, utf8(payload));
    }

    private BehaviorRef degraded(BehaviorHandle handle, String name, FingerprintStrategy strategy, byte[] payload,
                                 String origin, String reason) {
        BehaviorRef ref = new BehaviorRef(handle.getKind(), name, strategy, payload);
        try {
            listener.onDegraded(new BehaviorResolutionDegraded(origin, name, strategy, reason));
        } catch (RuntimeException e) {
            log.warn("Behavior resolution listener failed for {}", name, e);
        }
        return ref;
    }

    /**
     * A top-level or member class whose whole enclosing chain has source-level names.
     */
    static boolean isNamed(Class<?> type) {
        for (Class<?> c = type; c != null; c = c.getEnclosingClass()) {
            if (c.isAnonymousClass() || c.isLocalClass() || c.isSynthetic() || c.isHidden()) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAnonymousOrLocal(Class<?> type) {
        if (type.isHidden() || type.isSynthetic()) {
            return false;
        }
        for (Class<?> c = type; c != null; c = c.getEnclosingClass()) {
            if (c.isAnonymousClass() || c.isLocalClass()) {
                return true;
            }
        }
        return false;
    }

    private static byte[] readClassBytes(Class<?> type) {
        ClassLoader loader = type.getClassLoader();
        String resource = type.getName().replace('.', '/') + ".class";
        try (InputStream in = loader == null
                ? ClassLoader.getSystemResourceAsStream(resource)
                : loader.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No class file resource {} for {}", resource, type.getName());
                return null;
            }
            return in.readAllBytes();
        } catch (IOException e) {
            log.debug("Could not read class file {} for {}", resource, type.getName(), e);
            return null;
        }
    }

    /**
     * Implemented interfaces with their single abstract method, erased, sorted by interface name.
     * Falls back to the class's superclass name when it implements no interface.
     */
    static String functionalSignature(Class<?> type) {
        List<Class<?>> interfaces = new ArrayList<>(Arrays.asList(type.getInterfaces()));
        if (interfaces.isEmpty()) {
            Class<?> superclass = type.getSuperclass();
            return "extends " + (superclass == null ? "none" : superclass.getName());
        }
        interfaces.sort(Comparator.comparing(Class::getName));
        return interfaces.stream()
                .map(iface -> iface.getName() + abstractMethods(iface))
                .collect(Collectors.joining(";"));
    }

    private static String abstractMethods(Class<?> iface) {
        return Arrays.stream(iface.getMethods())
                .filter(m -> Modifier.isAbstract(m.getModifiers()) && !isObjectMethod(m))
                .map(m -> "#" + m.getName() + parameterList(m.getParameterTypes()) + m.getReturnType().getName())
                .sorted()
                .collect(Collectors.joining());
    }

    private static boolean isObjectMethod(Method method) {
        try {
            Object.class.getMethod(method.getName(), method.getParameterTypes());
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private static String parameterList(Class<?>[] types) {
        return Arrays.stream(types).map(Class::getName).collect(Collectors.joining(",", "(", ")"));
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
