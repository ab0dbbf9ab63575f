package com.schemaid.behavior;

import com.schemaid.describe.ReflectiveModelDescriptionProvider;
import com.schemaid.describe.annotation.FieldValidator;
import com.schemaid.extract.SchemaGraphExtractor;
import com.schemaid.model.BehaviorHandle;
import com.schemaid.model.BehaviorKind;
import com.schemaid.model.BehaviorRef;
import com.schemaid.model.FingerprintStrategy;
import com.schemaid.model.SchemaGraph;
import com.schemaid.model.SchemaNode;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for turning attached behaviors into portable references.
 */
class BehaviorFingerprintResolverTest {

    private final List<BehaviorResolutionDegraded> events = new ArrayList<>();
    private final BehaviorFingerprintResolver resolver = new BehaviorFingerprintResolver(events::add);

    static class NotBlankCheck implements Predicate<String> {
        @Override
        public boolean test(String value) {
            return !value.isBlank();
        }
    }

    record Account(String owner, String iban) {

        @FieldValidator("owner")
        static String checkOwner(String owner) {
            return owner.trim();
        }
    }

    @Test
    void testNamedMethodResolvesByName() throws Exception {
        Method method = Account.class.getDeclaredMethod("checkOwner", String.class);

        BehaviorRef ref = resolver.resolve(BehaviorHandle.ofMethod(BehaviorKind.VALIDATOR, method), "Account.owner");

        String expected = Account.class.getName() + "#checkOwner(java.lang.String)";
        assertThat(ref.getStrategy()).isEqualTo(FingerprintStrategy.BY_NAME);
        assertThat(ref.getQualifiedName()).isEqualTo(expected);
        assertThat(new String(ref.getPayload(), StandardCharsets.UTF_8)).isEqualTo(expected);
        assertThat(ref.isDegraded()).isFalse();
        assertThat(events).isEmpty();
    }

    @Test
    void testNamedFunctionClassResolvesByName() {
        BehaviorRef ref = resolver.resolve(
                BehaviorHandle.ofFunction(BehaviorKind.VALIDATOR, new NotBlankCheck()), "Account.owner");

        assertThat(ref.getStrategy()).isEqualTo(FingerprintStrategy.BY_NAME);
        assertThat(new String(ref.getPayload(), StandardCharsets.UTF_8)).isEqualTo(NotBlankCheck.class.getName());
        assertThat(events).isEmpty();
    }

    @Test
    void testAnonymousClassFallsBackToClassFileHash() {
        Predicate<String> anonymous = new Predicate<>() {
            @Override
            public boolean test(String value) {
                return value.length() > 2;
            }
        };

        BehaviorRef ref = resolver.resolve(BehaviorHandle.ofFunction(BehaviorKind.VALIDATOR, anonymous), "Account.iban");

        assertThat(ref.getStrategy()).isEqualTo(FingerprintStrategy.BY_SOURCE_HASH);
        assertThat(ref.getPayload()).hasSize(32);
        assertThat(ref.isDegraded()).isTrue();
        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.getOrigin()).isEqualTo("Account.iban");
            assertThat(e.getStrategy()).isEqualTo(FingerprintStrategy.BY_SOURCE_HASH);
        });
    }

    @Test
    void testLambdaFallsBackToFunctionalSignature() {
        Predicate<String> lambda = value -> value.startsWith("DE");

        BehaviorRef ref = resolver.resolve(BehaviorHandle.ofFunction(BehaviorKind.VALIDATOR, lambda), "Account.iban");

        assertThat(ref.getStrategy()).isEqualTo(FingerprintStrategy.BY_SIGNATURE);
        assertThat(new String(ref.getPayload(), StandardCharsets.UTF_8))
                .isEqualTo("java.util.function.Predicate#test(java.lang.Object)boolean");
        assertThat(events).singleElement()
                .extracting(BehaviorResolutionDegraded::getReason)
                .isEqualTo("lambda or method reference");
    }

    @Test
    void testDifferentStrategiesNeverShareBytes() {
        Predicate<String> lambda = value -> true;

        BehaviorRef byName = resolver.resolve(
                BehaviorHandle.ofFunction(BehaviorKind.VALIDATOR, new NotBlankCheck()), "x");
        BehaviorRef bySignature = resolver.resolve(
                BehaviorHandle.ofFunction(BehaviorKind.VALIDATOR, lambda), "x");

        assertThat(byName.getStrategy()).isNotEqualTo(bySignature.getStrategy());
    }

    @Test
    void testFailingListenerDoesNotBreakResolution() {
        BehaviorFingerprintResolver failing = new BehaviorFingerprintResolver(e -> {
            throw new IllegalStateException("listener down");
        });
        Predicate<String> lambda = value -> true;

        BehaviorRef ref = failing.resolve(BehaviorHandle.ofFunction(BehaviorKind.SERIALIZER, lambda), "x");

        assertThat(ref.getKind()).isEqualTo(BehaviorKind.SERIALIZER);
        assertThat(ref.getStrategy()).isEqualTo(FingerprintStrategy.BY_SIGNATURE);
    }

    @Test
    void testAnnotateResolvesEveryNodeAndCountsDegraded() {
        SchemaGraph graph = new SchemaGraphExtractor(new ReflectiveModelDescriptionProvider()).extract(Account.class);
        Predicate<String> lambda = value -> true;
        graph.getRoot().addBehaviors(List.of(BehaviorHandle.ofFunction(BehaviorKind.VALIDATOR, lambda)));

        int degraded = resolver.annotate(graph);

        assertThat(degraded).isEqualTo(1);
        assertThat(graph.getNodes()).allSatisfy(node -> assertThat(node.isBehaviorsResolved()).isTrue());
        SchemaNode owner = graph.getRoot().getChildren().get(0);
        assertThat(owner.getBehaviorRefs()).extracting(BehaviorRef::getStrategy)
                .containsExactly(FingerprintStrategy.BY_NAME);
    }

    @Test
    void testFunctionalSignatureOfPlainSubclass() {
        assertThat(BehaviorFingerprintResolver.functionalSignature(ArrayList.class))
                .contains("java.util.List#");
        assertThat(BehaviorFingerprintResolver.functionalSignature(Object.class)).isEqualTo("extends none");
    }
}
