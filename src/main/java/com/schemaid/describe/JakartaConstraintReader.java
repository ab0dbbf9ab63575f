package com.schemaid.describe;

import com.schemaid.exception.SchemaIdentityException;
import com.schemaid.exception.UnsupportedSchemaNodeException;
import com.schemaid.model.BehaviorHandle;
import com.schemaid.model.BehaviorKind;
import com.schemaid.model.Constraint;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertFalse;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.FutureOrPresent;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Negative;
import jakarta.validation.constraints.NegativeOrZero;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Null;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.annotation.Annotation;
import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns Jakarta Bean Validation annotations into schema constraints.
 *
 * Built-in constraints map onto named bounds; custom constraints (annotations meta-annotated with
 * {@link jakarta.validation.Constraint}) become one constraint per annotation whose value lists
 * their attributes as sorted {@code attr=value} entries, and contribute their {@code validatedBy}
 * classes as validators. A repeated constraint that maps onto several bounds is kept together the
 * same way, so the bounds of one instance are never mixed with those of another. Messages, groups
 * and payloads never participate.
 */
public class JakartaConstraintReader {

    private static final Logger log = LoggerFactory.getLogger(JakartaConstraintReader.class);

    private static final String BUILTIN_PACKAGE = "jakarta.validation.constraints";
    private static final Set<String> IGNORED_ATTRIBUTES = Set.of("message", "groups", "payload");

    /**
     * Constraints and validator behaviors read from one annotated position.
     */
    @Value
    public static class Result {
        List<Constraint> constraints;
        List<BehaviorHandle> behaviors;

        public boolean isEmpty() {
            return constraints.isEmpty() && behaviors.isEmpty();
        }
    }

    public Result read(Annotation[] annotations, String location) {
        List<Constraint> constraints = new ArrayList<>();
        List<BehaviorHandle> behaviors = new ArrayList<>();
        for (Annotation annotation : annotations) {
            readOne(annotation, "", constraints, behaviors, new HashSet<>(), location);
        }
        return new Result(List.copyOf(constraints), List.copyOf(behaviors));
    }

    private void readOne(Annotation a, String prefix, List<Constraint> out,
                         List<BehaviorHandle> behaviors, Set<Class<?>> visiting, String location) {
        Class<? extends Annotation> type = a.annotationType();

        if (a instanceof NotNull) {
            out.add(flag(prefix, "not_null"));
        } else if (a instanceof Null) {
            out.add(flag(prefix, "null"));
        } else if (a instanceof NotEmpty) {
            out.add(flag(prefix, "not_empty"));
        } else if (a instanceof NotBlank) {
            out.add(flag(prefix, "not_blank"));
        } else if (a instanceof Size size) {
            if (size.min() > 0) {
                out.add(Constraint.of(prefix + "min_length", size.min()));
            }
            if (size.max() != Integer.MAX_VALUE) {
                out.add(Constraint.of(prefix + "max_length", size.max()));
            }
        } else if (a instanceof Min min) {
            out.add(Constraint.of(prefix + "min", min.value()));
        } else if (a instanceof Max max) {
            out.add(Constraint.of(prefix + "max", max.value()));
        } else if (a instanceof DecimalMin decimalMin) {
            out.add(Constraint.of(prefix + "decimal_min", decimalMin.value()));
            if (!decimalMin.inclusive()) {
                out.add(flag(prefix, "decimal_min_exclusive"));
            }
        } else if (a instanceof DecimalMax decimalMax) {
            out.add(Constraint.of(prefix + "decimal_max", decimalMax.value()));
            if (!decimalMax.inclusive()) {
                out.add(flag(prefix, "decimal_max_exclusive"));
            }
        } else if (a instanceof Digits digits) {
            out.add(Constraint.of(prefix + "digits_integer", digits.integer()));
            out.add(Constraint.of(prefix + "digits_fraction", digits.fraction()));
        } else if (a instanceof Pattern pattern) {
            out.add(Constraint.of(prefix + "pattern", pattern.regexp()));
            addFlags(prefix + "pattern_flags", pattern.flags(), out);
        } else if (a instanceof Email email) {
            out.add(flag(prefix, "email"));
            if (!".*".equals(email.regexp())) {
                out.add(Constraint.of(prefix + "email_pattern", email.regexp()));
            }
            addFlags(prefix + "email_pattern_flags", email.flags(), out);
        } else if (a instanceof Positive) {
            out.add(flag(prefix, "positive"));
        } else if (a instanceof PositiveOrZero) {
            out.add(flag(prefix, "positive_or_zero"));
        } else if (a instanceof Negative) {
            out.add(flag(prefix, "negative"));
        } else if (a instanceof NegativeOrZero) {
            out.add(flag(prefix, "negative_or_zero"));
        } else if (a instanceof Past) {
            out.add(flag(prefix, "past"));
        } else if (a instanceof PastOrPresent) {
            out.add(flag(prefix, "past_or_present"));
        } else if (a instanceof Future) {
            out.add(flag(prefix, "future"));
        } else if (a instanceof FutureOrPresent) {
            out.add(flag(prefix, "future_or_present"));
        } else if (a instanceof AssertTrue) {
            out.add(flag(prefix, "assert_true"));
        } else if (a instanceof AssertFalse) {
            out.add(flag(prefix, "assert_false"));
        } else if (a instanceof Valid) {
            out.add(flag(prefix, "cascade"));
        } else if (isRepeatedContainer(type)) {
            for (Annotation repeated : repeatedValues(a)) {
                List<Constraint> one = new ArrayList<>();
                readOne(repeated, prefix, one, behaviors, visiting, location);
                if (one.size() > 1) {
                    out.add(group(prefix + "repeated:" + repeated.annotationType().getName(), one));
                } else {
                    out.addAll(one);
                }
            }
        } else if (type.isAnnotationPresent(jakarta.validation.Constraint.class)) {
            readCustom(a, prefix, out, behaviors, visiting, location);
        } else if (BUILTIN_PACKAGE.equals(type.getPackageName())) {
            throw new UnsupportedSchemaNodeException("@" + type.getName(), location);
        }
    }

    private void readCustom(Annotation a, String prefix, List<Constraint> out,
                            List<BehaviorHandle> behaviors, Set<Class<?>> visiting, String location) {
        Class<? extends Annotation> type = a.annotationType();
        String name = prefix + "constraint:" + type.getName();

        List<String> entries = new ArrayList<>();
        Method[] attributes = type.getDeclaredMethods();
        Arrays.sort(attributes, Comparator.comparing(Method::getName));
        for (Method attribute : attributes) {
            if (IGNORED_ATTRIBUTES.contains(attribute.getName()) || attribute.getParameterCount() > 0) {
                continue;
            }
            entries.add(attribute.getName() + "=" + renderAttribute(invoke(attribute, a, location)));
        }
        out.add(Constraint.values(name, entries));

        jakarta.validation.Constraint meta = type.getAnnotation(jakarta.validation.Constraint.class);
        for (Class<?> validator : meta.validatedBy()) {
            behaviors.add(BehaviorHandle.ofClass(BehaviorKind.VALIDATOR, validator));
        }

        // composed constraints declared on the annotation type itself
        if (visiting.add(type)) {
            for (Annotation composed : type.getAnnotations()) {
                readOne(composed, name + "/", out, behaviors, visiting, location);
            }
            visiting.remove(type);
        }
        log.debug("Read custom constraint {} at {}", type.getName(), location);
    }

    private static String renderAttribute(Object value) {
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<String> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(render(Array.get(value, i)));
            }
            return renderList(items);
        }
        return render(value);
    }

    private static Constraint group(String name, List<Constraint> members) {
        List<String> entries = members.stream()
                .map(c -> c.getName() + "=" + (c.getValueType() == Constraint.ValueType.LIST
                        ? renderList(c.getValues()) : String.valueOf(c.getValue())))
                .sorted()
                .toList();
        return Constraint.values(name, entries);
    }

    // length-prefixed so that "[a,b]" and "[a", "b]" never render alike
    private static String renderList(List<String> items) {
        return items.stream()
                .map(item -> item.length() + ":" + item)
                .collect(Collectors.joining(",", "[", "]"));
    }

    private static String render(Object value) {
        if (value instanceof Class<?> cls) {
            return cls.getName();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Annotation nested) {
            return "@" + nested.annotationType().getName();
        }
        return String.valueOf(value);
    }

    private static Object invoke(Method attribute, Annotation a, String location) {
        try {
            attribute.setAccessible(true);
            return attribute.invoke(a);
        } catch (IllegalAccessException | InvocationTargetException | RuntimeException e) {
            throw new SchemaIdentityException("Cannot read attribute " + attribute.getName() + " of @"
                    + a.annotationType().getName() + " at " + location, e);
        }
    }

    private static void addFlags(String name, Pattern.Flag[] flags, List<Constraint> out) {
        if (flags.length == 0) {
            return;
        }
        List<String> names = Arrays.stream(flags).map(Enum::name).sorted().distinct().toList();
        out.add(Constraint.values(name, names));
    }

    private static Constraint flag(String prefix, String name) {
        return Constraint.flag(prefix + name);
    }

    /**
     * {@code @Size.List}-style containers generated for repeatable constraints.
     */
    private static boolean isRepeatedContainer(Class<? extends Annotation> type) {
        try {
            Method value = type.getDeclaredMethod("value");
            Class<?> returned = value.getReturnType();
            if (!returned.isArray() || !returned.getComponentType().isAnnotation()) {
                return false;
            }
            Class<?> component = returned.getComponentType();
            return BUILTIN_PACKAGE.equals(component.getPackageName())
                    || component.isAnnotationPresent(jakarta.validation.Constraint.class);
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private static Annotation[] repeatedValues(Annotation container) {
        try {
            Method value = container.annotationType().getDeclaredMethod("value");
            value.setAccessible(true);
            return (Annotation[]) value.invoke(container);
        } catch (ReflectiveOperationException e) {
            throw new SchemaIdentityException("Cannot unwrap repeated constraint @"
                    + container.annotationType().getName(), e);
        }
    }
}
