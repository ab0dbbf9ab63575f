package com.schemaid.describe;

import com.schemaid.describe.annotation.FieldSerializer;
import com.schemaid.describe.annotation.FieldValidator;
import com.schemaid.describe.annotation.ModelSerializer;
import com.schemaid.describe.annotation.ModelValidator;
import com.schemaid.describe.annotation.OneOf;
import com.schemaid.describe.annotation.SchemaDescription;
import com.schemaid.describe.annotation.SchemaField;
import com.schemaid.exception.SchemaIdentityException;
import com.schemaid.exception.UnsupportedSchemaNodeException;
import com.schemaid.model.BehaviorHandle;
import com.schemaid.model.BehaviorKind;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedArrayType;
import java.lang.reflect.AnnotatedParameterizedType;
import java.lang.reflect.AnnotatedType;
import java.lang.reflect.AnnotatedTypeVariable;
import java.lang.reflect.AnnotatedWildcardType;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Describes records and plain classes through reflection.
 *
 * Records contribute their components; other classes their non-static, non-transient instance
 * fields, superclass fields first. Jakarta Bean Validation annotations become constraints, both
 * on the field itself and on type arguments ({@code List<@Size(max = 3) String>}).
 */
public class ReflectiveModelDescriptionProvider implements ModelDescriptionProvider {

    private static final Logger log = LoggerFactory.getLogger(ReflectiveModelDescriptionProvider.class);

    private static final Map<Class<?>, String> SCALAR_TAGS = Map.ofEntries(
            Map.entry(boolean.class, "bool"),
            Map.entry(Boolean.class, "bool"),
            Map.entry(byte.class, "int8"),
            Map.entry(Byte.class, "int8"),
            Map.entry(short.class, "int16"),
            Map.entry(Short.class, "int16"),
            Map.entry(int.class, "int32"),
            Map.entry(Integer.class, "int32"),
            Map.entry(long.class, "int64"),
            Map.entry(Long.class, "int64"),
            Map.entry(float.class, "float32"),
            Map.entry(Float.class, "float32"),
            Map.entry(double.class, "float64"),
            Map.entry(Double.class, "float64"),
            Map.entry(char.class, "char"),
            Map.entry(Character.class, "char"),
            Map.entry(String.class, "string"),
            Map.entry(CharSequence.class, "string"),
            Map.entry(BigDecimal.class, "decimal"),
            Map.entry(BigInteger.class, "bigint"),
            Map.entry(byte[].class, "bytes"),
            Map.entry(UUID.class, "uuid"),
            Map.entry(LocalDate.class, "date"),
            Map.entry(LocalTime.class, "time"),
            Map.entry(LocalDateTime.class, "datetime"),
            Map.entry(OffsetDateTime.class, "datetime_tz"),
            Map.entry(ZonedDateTime.class, "datetime_tz"),
            Map.entry(Instant.class, "instant"),
            Map.entry(Duration.class, "duration"),
            Map.entry(Period.class, "period"),
            Map.entry(URI.class, "uri"),
            Map.entry(URL.class, "uri"),
            Map.entry(Object.class, "any"));

    private static final Map<Class<?>, String> OPTIONAL_PRIMITIVES = Map.of(
            OptionalInt.class, "int32",
            OptionalLong.class, "int64",
            OptionalDouble.class, "float64");

    private static final Set<String> JDK_PREFIXES = Set.of("java.", "javax.", "jdk.", "sun.", "com.sun.");

    private final JakartaConstraintReader constraintReader = new JakartaConstraintReader();
    private final BehaviorRegistry registry;

    public ReflectiveModelDescriptionProvider() {
        this(new BehaviorRegistry());
    }

    public ReflectiveModelDescriptionProvider(BehaviorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public ModelDescription describe(Class<?> model) {
        requireModelClass(model, model.getName());

        String origin = model.getName();
        JakartaConstraintReader.Result classLevel = constraintReader.read(model.getAnnotations(), origin);
        SchemaDescription description = model.getAnnotation(SchemaDescription.class);

        ModelDescription.ModelDescriptionBuilder builder = ModelDescription.builder()
                .modelType(model)
                .description(description == null ? null : description.value())
                .constraints(classLevel.getConstraints())
                .constraintBehaviors(classLevel.getBehaviors());

        for (Field field : modelFields(model)) {
            builder.field(describeField(model, field));
        }

        ModelDescription result = builder.build();
        log.debug("Described model {} with {} fields", model.getName(), result.getFields().size());
        return result;
    }

    @Override
    public List<BehaviorHandle> listModelBehaviors(Class<?> model) {
        List<AnnotatedBehavior> found = new ArrayList<>();
        for (Method method : behaviorMethods(model)) {
            ModelValidator validator = method.getAnnotation(ModelValidator.class);
            if (validator != null) {
                found.add(new AnnotatedBehavior(validator.order(), BehaviorKind.VALIDATOR, method));
            }
            ModelSerializer serializer = method.getAnnotation(ModelSerializer.class);
            if (serializer != null) {
                found.add(new AnnotatedBehavior(serializer.order(), BehaviorKind.SERIALIZER, method));
            }
        }
        return ordered(found, registry.forModel(model));
    }

    @Override
    public List<BehaviorHandle> listFieldBehaviors(Class<?> model, String fieldName) {
        List<AnnotatedBehavior> found = new ArrayList<>();
        for (Method method : behaviorMethods(model)) {
            FieldValidator validator = method.getAnnotation(FieldValidator.class);
            if (validator != null && Arrays.asList(validator.value()).contains(fieldName)) {
                found.add(new AnnotatedBehavior(validator.order(), BehaviorKind.VALIDATOR, method));
            }
            FieldSerializer serializer = method.getAnnotation(FieldSerializer.class);
            if (serializer != null && Arrays.asList(serializer.value()).contains(fieldName)) {
                found.add(new AnnotatedBehavior(serializer.order(), BehaviorKind.SERIALIZER, method));
            }
        }
        return ordered(found, registry.forField(model, fieldName));
    }

    // ---- Fields ----

    private List<Field> modelFields(Class<?> model) {
        if (model.isRecord()) {
            List<Field> fields = new ArrayList<>();
            for (RecordComponent component : model.getRecordComponents()) {
                fields.add(backingField(model, component.getName()));
            }
            return fields;
        }

        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = model; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        Map<String, Field> byName = new LinkedHashMap<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                    continue;
                }
                byName.put(field.getName(), field);
            }
        }
        return new ArrayList<>(byName.values());
    }

    private static Field backingField(Class<?> record, String name) {
        try {
            return record.getDeclaredField(name);
        } catch (NoSuchFieldException e) {
            throw new SchemaIdentityException("Record " + record.getName() + " has no field for component " + name, e);
        }
    }

    private FieldDescription describeField(Class<?> model, Field field) {
        String origin = model.getName() + "." + field.getName();
        Annotation[] annotations = rootAnnotations(field);

        TypeDescriptor type;
        OneOf oneOf = field.getAnnotation(OneOf.class);
        if (oneOf != null) {
            if (oneOf.value().length == 0) {
                throw new UnsupportedSchemaNodeException("empty @OneOf", origin);
            }
            List<TypeDescriptor> members = new ArrayList<>();
            for (Class<?> member : oneOf.value()) {
                members.add(describeClass(member, origin + "|" + member.getSimpleName()));
            }
            type = withConstraints(TypeDescriptor.union("one_of", members, origin), annotations, origin);
        } else {
            type = describeType(field.getAnnotatedType(), annotations, origin);
        }

        SchemaField meta = field.getAnnotation(SchemaField.class);
        return FieldDescription.builder()
                .name(field.getName())
                .alias(meta == null ? null : emptyToNull(meta.alias()))
                .description(meta == null ? null : emptyToNull(meta.description()))
                .defaultPresent(meta != null && meta.hasDefault())
                .type(type)
                .build();
    }

    /**
     * Declaration annotations plus type-use annotations on the field type itself. Jakarta
     * constraints target both, so javac may record the same annotation twice.
     */
    private static Annotation[] rootAnnotations(Field field) {
        Set<Annotation> annotations = new LinkedHashSet<>(Arrays.asList(field.getDeclaredAnnotations()));
        annotations.addAll(Arrays.asList(field.getAnnotatedType().getDeclaredAnnotations()));
        return annotations.toArray(new Annotation[0]);
    }

    // ---- Types ----

    private TypeDescriptor describeType(AnnotatedType annotatedType, Annotation[] annotations, String origin) {
        return withConstraints(describeShape(annotatedType, origin), annotations, origin);
    }

    private TypeDescriptor describeArgument(AnnotatedType annotatedType, String origin) {
        return describeType(annotatedType, annotatedType.getDeclaredAnnotations(), origin);
    }

    private TypeDescriptor withConstraints(TypeDescriptor type, Annotation[] annotations, String origin) {
        JakartaConstraintReader.Result read = constraintReader.read(annotations, origin);
        if (read.isEmpty()) {
            return type;
        }
        return type.toBuilder()
                .constraints(read.getConstraints())
                .behaviors(read.getBehaviors())
                .build();
    }

    private TypeDescriptor describeShape(AnnotatedType annotatedType, String origin) {
        if (annotatedType instanceof AnnotatedTypeVariable) {
            throw new UnsupportedSchemaNodeException("type variable " + annotatedType.getType().getTypeName(), origin);
        }
        if (annotatedType instanceof AnnotatedWildcardType) {
            throw new UnsupportedSchemaNodeException("wildcard " + annotatedType.getType().getTypeName(), origin);
        }
        if (annotatedType instanceof AnnotatedArrayType arrayType) {
            if (annotatedType.getType() == byte[].class) {
                return TypeDescriptor.scalar("bytes", origin);
            }
            TypeDescriptor element = describeArgument(arrayType.getAnnotatedGenericComponentType(), origin + "[]");
            return TypeDescriptor.container("array", List.of(element), origin);
        }
        if (annotatedType instanceof AnnotatedParameterizedType parameterized) {
            return describeParameterized(parameterized, origin);
        }
        if (annotatedType.getType() instanceof Class<?> cls) {
            return describeClass(cls, origin);
        }
        throw new UnsupportedSchemaNodeException(annotatedType.getType().getTypeName(), origin);
    }

    private TypeDescriptor describeParameterized(AnnotatedParameterizedType parameterized, String origin) {
        ParameterizedType type = (ParameterizedType) parameterized.getType();
        Class<?> raw = (Class<?>) type.getRawType();
        AnnotatedType[] args = parameterized.getAnnotatedActualTypeArguments();

        if (raw == Optional.class) {
            return optionalOf(describeArgument(args[0], origin + "?"), origin);
        }
        if (Map.class.isAssignableFrom(raw) && args.length == 2) {
            TypeDescriptor key = describeArgument(args[0], origin + "{key}");
            TypeDescriptor value = describeArgument(args[1], origin + "{value}");
            return TypeDescriptor.container("map", List.of(key, value), origin);
        }
        if (Set.class.isAssignableFrom(raw) && args.length == 1) {
            return TypeDescriptor.container("set", List.of(describeArgument(args[0], origin + "[]")), origin);
        }
        if ((Collection.class.isAssignableFrom(raw) || raw == Iterable.class) && args.length == 1) {
            return TypeDescriptor.container("list", List.of(describeArgument(args[0], origin + "[]")), origin);
        }
        throw new UnsupportedSchemaNodeException("parameterized type " + type.getTypeName(), origin);
    }

    private TypeDescriptor describeClass(Class<?> cls, String origin) {
        String scalar = SCALAR_TAGS.get(cls);
        if (scalar != null) {
            return TypeDescriptor.scalar(scalar, origin);
        }
        String optionalPrimitive = OPTIONAL_PRIMITIVES.get(cls);
        if (optionalPrimitive != null) {
            return optionalOf(TypeDescriptor.scalar(optionalPrimitive, origin + "?"), origin);
        }
        if (cls.isArray()) {
            TypeDescriptor element = describeClass(cls.getComponentType(), origin + "[]");
            return TypeDescriptor.container("array", List.of(element), origin);
        }
        if (cls.isEnum()) {
            List<String> names = Arrays.stream(cls.getEnumConstants())
                    .map(constant -> ((Enum<?>) constant).name())
                    .collect(Collectors.toList());
            return TypeDescriptor.literal(names, origin);
        }
        if (Iterable.class.isAssignableFrom(cls) || Map.class.isAssignableFrom(cls) || cls == Optional.class) {
            throw new UnsupportedSchemaNodeException("raw type " + cls.getName(), origin);
        }
        if (cls.isSealed()) {
            List<TypeDescriptor> members = new ArrayList<>();
            for (Class<?> permitted : cls.getPermittedSubclasses()) {
                members.add(describeClass(permitted, origin + "|" + permitted.getSimpleName()));
            }
            return TypeDescriptor.union("sealed", members, origin);
        }
        requireModelClass(cls, origin);
        return TypeDescriptor.model(cls, origin);
    }

    private static TypeDescriptor optionalOf(TypeDescriptor present, String origin) {
        return TypeDescriptor.union("optional", List.of(present, TypeDescriptor.scalar("none", origin)), origin);
    }

    private static void requireModelClass(Class<?> cls, String origin) {
        if (cls.isPrimitive() || cls.isArray() || cls.isEnum() || cls.isAnnotation()) {
            throw new UnsupportedSchemaNodeException("non-model type " + cls.getName(), origin);
        }
        if (isJdkType(cls)) {
            throw new UnsupportedSchemaNodeException("JDK type " + cls.getName(), origin);
        }
        if (cls.isInterface() || Modifier.isAbstract(cls.getModifiers())) {
            throw new UnsupportedSchemaNodeException("abstract type " + cls.getName()
                    + " (seal it or declare @OneOf)", origin);
        }
        if (cls.getTypeParameters().length > 0) {
            throw new UnsupportedSchemaNodeException("generic model " + cls.getName(), origin);
        }
    }

    private static boolean isJdkType(Class<?> cls) {
        String name = cls.getName();
        return JDK_PREFIXES.stream().anyMatch(name::startsWith);
    }

    // ---- Behaviors ----

    /**
     * Non-synthetic methods of the model and its superclasses; an override hides the method it
     * overrides.
     */
    private static List<Method> behaviorMethods(Class<?> model) {
        Map<String, Method> bySignature = new LinkedHashMap<>();
        for (Class<?> c = model; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Method method : c.getDeclaredMethods()) {
                if (method.isSynthetic() || method.isBridge()) {
                    continue;
                }
                bySignature.putIfAbsent(method.getName() + parameterList(method), method);
            }
        }
        return new ArrayList<>(bySignature.values());
    }

    private static List<BehaviorHandle> ordered(List<AnnotatedBehavior> annotated, List<BehaviorHandle> registered) {
        annotated.sort(Comparator
                .comparingInt(AnnotatedBehavior::getOrder)
                .thenComparing(b -> b.getMethod().getName())
                .thenComparing(b -> parameterList(b.getMethod()))
                .thenComparing(b -> b.getMethod().getDeclaringClass().getName())
                .thenComparingInt(b -> b.getKind().getCode()));

        List<BehaviorHandle> handles = new ArrayList<>(annotated.size() + registered.size());
        for (AnnotatedBehavior behavior : annotated) {
            handles.add(BehaviorHandle.ofMethod(behavior.getKind(), behavior.getMethod()));
        }
        handles.addAll(registered);
        return handles;
    }

    static String parameterList(Method method) {
        return Arrays.stream(method.getParameterTypes())
                .map(Class::getName)
                .collect(Collectors.joining(",", "(", ")"));
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    @Value
    private static class AnnotatedBehavior {
        int order;
        BehaviorKind kind;
        Method method;
    }
}
