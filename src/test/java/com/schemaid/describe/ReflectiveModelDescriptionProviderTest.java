package com.schemaid.describe;

import com.schemaid.describe.annotation.FieldValidator;
import com.schemaid.describe.annotation.ModelSerializer;
import com.schemaid.describe.annotation.ModelValidator;
import com.schemaid.describe.annotation.SchemaDescription;
import com.schemaid.describe.annotation.SchemaField;
import com.schemaid.exception.UnsupportedSchemaNodeException;
import com.schemaid.model.BehaviorHandle;
import com.schemaid.model.BehaviorKind;
import com.schemaid.model.Constraint;
import com.schemaid.model.NodeKind;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import jakarta.validation.Payload;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.junit.jupiter.api.Test;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for describing records and plain classes through reflection.
 */
class ReflectiveModelDescriptionProviderTest {

    private final ReflectiveModelDescriptionProvider provider = new ReflectiveModelDescriptionProvider();

    record Scalars(int count, Integer boxed, String name, BigDecimal amount, LocalDate day, byte[] data) {}

    record Tagged(@NotNull @Size(max = 5) List<@Size(max = 3) String> tags) {}

    record Containers(Optional<String> nickname, Map<String, Integer> scores) {}

    enum Color { RED, GREEN, BLUE }

    record Painted(Color color) {}

    sealed interface Shape {}

    record Circle(double radius) implements Shape {}

    record Square(double side) implements Shape {}

    record Drawing(Shape shape) {}

    record Generic<T>(T value) {}

    record Wildcard(List<?> items) {}

    @SuppressWarnings("rawtypes")
    record Raw(List items) {}

    record JdkType(Thread thread) {}

    @SchemaDescription("A described model")
    record Described(@SchemaField(alias = "full_name", description = "Name of the person", hasDefault = true) String name) {}

    static class Base {
        static int ignoredStatic;
        transient int ignoredTransient;
        String id;
    }

    static class Child extends Base {
        int count;
    }

    record Validated(String name, String code) {

        @FieldValidator(value = "name", order = 2)
        static String second(String name) {
            return name;
        }

        @FieldValidator(value = {"name", "code"}, order = 1)
        static String first(String value) {
            return value;
        }

        @ModelValidator
        void whole() {
        }

        @ModelSerializer
        String serialize() {
            return name;
        }
    }

    @Retention(RetentionPolicy.RUNTIME)
    @Target({ElementType.FIELD, ElementType.TYPE_USE})
    @jakarta.validation.Constraint(validatedBy = UpperValidator.class)
    @interface Upper {
        String message() default "must be upper case";

        Class<?>[] groups() default {};

        Class<? extends Payload>[] payload() default {};

        boolean strict() default true;
    }

    public static class UpperValidator implements ConstraintValidator<Upper, String> {
        @Override
        public boolean isValid(String value, ConstraintValidatorContext context) {
            return value == null || value.equals(value.toUpperCase());
        }
    }

    record Coded(@Upper(strict = false) String code) {}

    record Repeated(@Pattern.List({@Pattern(regexp = "[a-z]+"), @Pattern(regexp = ".{2,}")}) String word) {}

    record Bounded(@Min(1) int quantity) {}

    record Windowed(@Size(min = 1, max = 5) @Size(min = 2, max = 3) String text) {}

    @Test
    void testScalarTags() {
        ModelDescription d = provider.describe(Scalars.class);

        assertThat(d.getFields()).extracting(FieldDescription::getName)
                .containsExactly("count", "boxed", "name", "amount", "day", "data");
        assertThat(d.getFields()).extracting(f -> f.getType().getTag())
                .containsExactly("int32", "int32", "string", "decimal", "date", "bytes");
        assertThat(d.getFields()).allSatisfy(f -> assertThat(f.getType().getKind()).isEqualTo(NodeKind.SCALAR));
    }

    @Test
    void testFieldAndTypeArgumentConstraints() {
        TypeDescriptor tags = provider.describe(Tagged.class).getFields().get(0).getType();

        assertThat(tags.getKind()).isEqualTo(NodeKind.CONTAINER);
        assertThat(tags.getTag()).isEqualTo("list");
        assertThat(tags.getConstraints()).containsExactlyInAnyOrder(
                Constraint.flag("not_null"), Constraint.of("max_length", 5));

        TypeDescriptor element = tags.getArguments().get(0);
        assertThat(element.getTag()).isEqualTo("string");
        assertThat(element.getConstraints()).containsExactly(Constraint.of("max_length", 3));
    }

    @Test
    void testOptionalAndMap() {
        ModelDescription d = provider.describe(Containers.class);

        TypeDescriptor nickname = d.getFields().get(0).getType();
        assertThat(nickname.getKind()).isEqualTo(NodeKind.UNION);
        assertThat(nickname.getTag()).isEqualTo("optional");
        assertThat(nickname.getArguments()).extracting(TypeDescriptor::getTag).containsExactly("string", "none");

        TypeDescriptor scores = d.getFields().get(1).getType();
        assertThat(scores.getTag()).isEqualTo("map");
        assertThat(scores.getArguments()).extracting(TypeDescriptor::getTag).containsExactly("string", "int32");
    }

    @Test
    void testEnumBecomesLiteral() {
        TypeDescriptor color = provider.describe(Painted.class).getFields().get(0).getType();

        assertThat(color.getKind()).isEqualTo(NodeKind.LITERAL);
        assertThat(color.getConstraints()).hasSize(1);
        assertThat(color.getConstraints().get(0).getValues()).containsExactly("RED", "GREEN", "BLUE");
    }

    @Test
    void testSealedInterfaceBecomesUnionOfModels() {
        TypeDescriptor shape = provider.describe(Drawing.class).getFields().get(0).getType();

        assertThat(shape.getKind()).isEqualTo(NodeKind.UNION);
        assertThat(shape.getTag()).isEqualTo("sealed");
        assertThat(shape.getArguments()).extracting(TypeDescriptor::getModelType)
                .containsExactlyInAnyOrder(Circle.class, Square.class);
    }

    @Test
    void testUnsupportedConstructsFailHard() {
        assertThatThrownBy(() -> provider.describe(Generic.class))
                .isInstanceOf(UnsupportedSchemaNodeException.class)
                .hasMessageContaining("generic model");
        assertThatThrownBy(() -> provider.describe(Wildcard.class))
                .isInstanceOf(UnsupportedSchemaNodeException.class)
                .hasMessageContaining("wildcard");
        assertThatThrownBy(() -> provider.describe(Raw.class))
                .isInstanceOf(UnsupportedSchemaNodeException.class)
                .hasMessageContaining("raw type");
        assertThatThrownBy(() -> provider.describe(JdkType.class))
                .isInstanceOf(UnsupportedSchemaNodeException.class)
                .hasMessageContaining("JDK type");
    }

    @Test
    void testUnsupportedExceptionCarriesLocation() {
        UnsupportedSchemaNodeException e = catchThrowableOfType(
                () -> provider.describe(Wildcard.class), UnsupportedSchemaNodeException.class);

        assertThat(e.getLocation()).isEqualTo(Wildcard.class.getName() + ".items[]");
    }

    @Test
    void testDescriptionsAliasAndDefault() {
        ModelDescription d = provider.describe(Described.class);

        assertThat(d.getDescription()).isEqualTo("A described model");
        FieldDescription name = d.getFields().get(0);
        assertThat(name.getAlias()).isEqualTo("full_name");
        assertThat(name.getDescription()).isEqualTo("Name of the person");
        assertThat(name.isDefaultPresent()).isTrue();
    }

    @Test
    void testPlainClassFieldsIncludeSuperclassAndSkipStaticAndTransient() {
        ModelDescription d = provider.describe(Child.class);

        assertThat(d.getFields()).extracting(FieldDescription::getName).containsExactly("id", "count");
    }

    @Test
    void testFieldBehaviorsOrderedByOrderThenRegistry() {
        Predicate<String> registered = s -> !s.isEmpty();
        BehaviorRegistry registry = new BehaviorRegistry().fieldValidator(Validated.class, "name", registered);
        ReflectiveModelDescriptionProvider withRegistry = new ReflectiveModelDescriptionProvider(registry);

        List<BehaviorHandle> behaviors = withRegistry.listFieldBehaviors(Validated.class, "name");

        assertThat(behaviors).hasSize(3);
        assertThat(((Method) behaviors.get(0).getImplementation()).getName()).isEqualTo("first");
        assertThat(((Method) behaviors.get(1).getImplementation()).getName()).isEqualTo("second");
        assertThat(behaviors.get(2).getForm()).isEqualTo(BehaviorHandle.Form.FUNCTION);
        assertThat(behaviors.get(2).getImplementation()).isSameAs(registered);

        assertThat(withRegistry.listFieldBehaviors(Validated.class, "code")).hasSize(1);
    }

    @Test
    void testModelBehaviorsCarryTheirKind() {
        List<BehaviorHandle> behaviors = provider.listModelBehaviors(Validated.class);

        assertThat(behaviors).extracting(BehaviorHandle::getKind)
                .containsExactlyInAnyOrder(BehaviorKind.VALIDATOR, BehaviorKind.SERIALIZER);
    }

    @Test
    void testCustomConstraintContributesAttributesAndValidator() {
        TypeDescriptor code = provider.describe(Coded.class).getFields().get(0).getType();
        String name = "constraint:" + Upper.class.getName();

        assertThat(code.getConstraints()).containsExactly(Constraint.values(name, List.of("strict=false")));
        assertThat(code.getBehaviors()).singleElement()
                .satisfies(b -> {
                    assertThat(b.getKind()).isEqualTo(BehaviorKind.VALIDATOR);
                    assertThat(b.getImplementation()).isEqualTo(UpperValidator.class);
                });
    }

    @Test
    void testRepeatedConstraintsAreUnwrapped() {
        TypeDescriptor word = provider.describe(Repeated.class).getFields().get(0).getType();

        assertThat(word.getConstraints()).containsExactlyInAnyOrder(
                Constraint.of("pattern", "[a-z]+"), Constraint.of("pattern", ".{2,}"));
    }

    @Test
    void testRepeatedMultiBoundConstraintKeepsEachInstanceTogether() {
        TypeDescriptor text = provider.describe(Windowed.class).getFields().get(0).getType();
        String name = "repeated:" + Size.class.getName();

        assertThat(text.getConstraints()).containsExactlyInAnyOrder(
                Constraint.values(name, List.of("max_length=5", "min_length=1")),
                Constraint.values(name, List.of("max_length=3", "min_length=2")));
    }

    @Test
    void testNumericBound() {
        TypeDescriptor quantity = provider.describe(Bounded.class).getFields().get(0).getType();

        assertThat(quantity.getConstraints()).containsExactly(Constraint.of("min", 1L));
    }
}
