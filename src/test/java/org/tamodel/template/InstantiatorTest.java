package org.tamodel.template;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tamodel.diagnostics.Result;
import org.tamodel.diagnostics.TypeError;
import org.tamodel.lsc.EventPrecedence;
import org.tamodel.position.Position;
import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Frame;
import org.tamodel.symbols.Symbol;
import org.tamodel.symbols.Type;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Instantiator}: binding order, the parameter frame layout,
 * restricted parameter propagation and rejection of surplus arguments.
 */
@Tag("unit")
class InstantiatorTest {

    private Symbol p0;
    private Symbol p1;
    private Symbol p2;
    private Template template;

    @BeforeEach
    void setUp() {
        p0 = param("p0");
        p1 = param("p1");
        p2 = param("p2");
        Symbol name = new Symbol("T", Type.of(Type.Kind.PROCESS), Position.UNKNOWN);
        template = new Template(name, Frame.of(p0, p1, p2), new Frame(), EventPrecedence.DEFAULT, true, "", "");
    }

    private static Symbol param(String name) {
        return new Symbol(name, Type.of(Type.Kind.INT), Position.UNKNOWN);
    }

    private static Symbol instanceName(String name) {
        return new Symbol(name, Type.of(Type.Kind.INSTANCE), Position.UNKNOWN);
    }

    /**
     * Arguments bind the free parameters of the base from left to right and the
     * bound parameters move to the end of the frame.
     */
    @Test
    void bindsArgumentsLeftToRight() {
        // Arrange
        Expression one = Expression.constant("1");

        // Act
        Instance instance = Instantiator.instantiate(instanceName("I"), template.getInstance(),
                new Frame(), List.of(one)).get();

        // Assert
        assertThat(instance.getUnbound()).isEqualTo(2);
        assertThat(instance.getArguments()).isEqualTo(1);
        assertThat(instance.getMapping()).containsExactly(java.util.Map.entry(p0, one));
        assertThat(instance.getParameters().getSymbols()).containsExactly(p1, p2, p0);
        assertThat(instance.isUnboundParameter(p1)).isTrue();
        assertThat(instance.isUnboundParameter(p0)).isFalse();
        assertThat(instance.getTemplate()).isSameAs(template);
    }

    /**
     * Parameters of the instantiation that the base already has are ignored, while
     * new ones become the leading free parameters of the result.
     */
    @Test
    void freshParametersComeFirst() {
        // Arrange
        Symbol q = param("q");
        Frame params = Frame.of(q, p0, p1, p2);

        // Act
        Instance instance = Instantiator.instantiate(instanceName("I"), template.getInstance(), params,
                List.of(Expression.of("q + 1", q))).get();

        // Assert
        assertThat(instance.getUnbound()).isEqualTo(3);
        assertThat(instance.getParameters().getSymbols()).containsExactly(q, p1, p2, p0);
        assertThat(instance.writeParameters()).isEqualTo("int q, int p1, int p2");
    }

    /**
     * Instantiating in two steps gives the same mapping and frame as instantiating
     * once with all arguments.
     */
    @Test
    void stepwiseInstantiationMatchesSingleStep() {
        // Arrange
        Expression a = Expression.constant("a");
        Expression b = Expression.constant("b");

        // Act
        Instance step = Instantiator.instantiate(instanceName("I1"), template.getInstance(), new Frame(), List.of(a)).get();
        Instance twoSteps = Instantiator.instantiate(instanceName("I2"), step, new Frame(), List.of(b)).get();
        Instance oneStep = Instantiator.instantiate(instanceName("I3"), template.getInstance(), new Frame(), List.of(a, b)).get();

        // Assert
        assertThat(twoSteps.getMapping()).containsExactlyEntriesOf(oneStep.getMapping());
        assertThat(twoSteps.getParameters().getSymbols()).isEqualTo(oneStep.getParameters().getSymbols());
        assertThat(twoSteps.getUnbound()).isEqualTo(oneStep.getUnbound()).isEqualTo(1);
        assertThat(twoSteps.getArguments()).isEqualTo(2);
        assertThat(twoSteps.writeMapping()).isEqualTo("p0 = a, p1 = b");
        assertThat(twoSteps.writeArguments()).isEqualTo("a, b");
    }

    /**
     * More arguments than free parameters are rejected and the base keeps its state.
     */
    @Test
    void rejectsTooManyArguments() {
        // Arrange
        Instance closed = Instantiator.instantiate(instanceName("I"), template.getInstance(), new Frame(),
                List.of(Expression.constant("1"), Expression.constant("2"), Expression.constant("3"))).get();

        // Act
        Result<Instance> result = Instantiator.instantiate(instanceName("J"), closed, new Frame(),
                List.of(Expression.constant("4")));

        // Assert
        assertThat(closed.isClosed()).isTrue();
        assertThat(result.isError()).isTrue();
        assertThat(result.error()).hasValueSatisfying(e -> {
            assertThat(e.kind()).isEqualTo(TypeError.Kind.TOO_MANY_ARGUMENTS);
            assertThat(e.message()).isEqualTo("Too many arguments to I");
        });
        assertThat(closed.getUnbound()).isZero();
        assertThat(closed.getMapping()).hasSize(3);
        assertThatThrownBy(result::get).isInstanceOf(java.util.NoSuchElementException.class);
    }

    /**
     * A free parameter used in an argument for a restricted parameter becomes
     * restricted itself; constants and unrestricted positions add nothing.
     */
    @Test
    void propagatesRestrictionsThroughArguments() {
        // Arrange
        Symbol n = param("n");
        Symbol m = param("m");
        template.getInstance().addRestricted(p0);

        // Act
        Instance instance = Instantiator.instantiate(instanceName("I"), template.getInstance(), Frame.of(n, m),
                List.of(Expression.of("n * 2", n), Expression.of("m", m))).get();
        Instance constant = Instantiator.instantiate(instanceName("K"), template.getInstance(), new Frame(),
                List.of(Expression.constant("5"))).get();

        // Assert
        assertThat(instance.getRestricted()).containsExactlyInAnyOrder(p0, n);
        assertThat(instance.isRestricted(m)).isFalse();
        assertThat(constant.getRestricted()).containsExactly(p0);
    }

    /**
     * The base instance object is never modified by an instantiation.
     */
    @Test
    void leavesBaseUntouched() {
        // Arrange
        Instance base = template.getInstance();

        // Act
        Instantiator.instantiate(instanceName("I"), base, Frame.of(param("x")), List.of(Expression.constant("1")));

        // Assert
        assertThat(base.getUnbound()).isEqualTo(3);
        assertThat(base.getMapping()).isEmpty();
        assertThat(base.getParameters().getSymbols()).containsExactly(p0, p1, p2);
    }

    /**
     * The instance constructor refuses layouts whose bound suffix has no arguments.
     */
    @Test
    void constructorChecksLayout() {
        assertThatThrownBy(() -> new Instance(instanceName("bad"), Frame.of(p0, p1), java.util.Map.of(), 0, 1,
                template, java.util.Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
