package org.tamodel.document;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tamodel.arena.Handle;
import org.tamodel.config.ModelSettings;
import org.tamodel.diagnostics.DiagnosticsEngine;
import org.tamodel.diagnostics.Result;
import org.tamodel.lsc.InstanceLine;
import org.tamodel.lsc.Message;
import org.tamodel.position.Position;
import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Frame;
import org.tamodel.symbols.Symbol;
import org.tamodel.symbols.Type;
import org.tamodel.template.Instance;
import org.tamodel.template.State;
import org.tamodel.template.Template;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the deep copy constructor of {@link Document}.
 */
@Tag("unit")
class DocumentCopyTest {

    private Document original;
    private Template template;
    private Template chart;
    private Instance process;

    @BeforeEach
    void setUp() {
        original = new Document(ModelSettings.defaults(), new DiagnosticsEngine(false));
        Symbol id = new Symbol("id", Type.of(Type.Kind.INT), Position.UNKNOWN);
        original.addVariable(original.getGlobals(), Type.of(Type.Kind.CLOCK), "x", Expression.EMPTY, Position.UNKNOWN);
        template = original.addTemplate("P", Frame.of(id), Position.UNKNOWN).get();
        template.addLocation("idle", Expression.EMPTY, Expression.EMPTY, Position.UNKNOWN);
        process = original.addInstance("P1", template, new Frame(), List.of(Expression.constant("1")), Position.UNKNOWN).get();
        original.addProcess(process, Position.UNKNOWN);

        chart = original.addTemplate("C", new Frame(), Position.UNKNOWN, false, "universal", "invariant").get();
        InstanceLine line = chart.addInstanceLine("l", Position.UNKNOWN).get();
        line.addParameters(template.getInstance(), new Frame(), List.of(Expression.constant("1")));
        original.setProcPriority("P1", 2);
        original.addError(Position.UNKNOWN, "earlier", "");
    }

    /**
     * The copy holds new templates and instances that point at each other, not at
     * the original document.
     */
    @Test
    void copiesTemplatesAndRelinksInstances() {
        // Act
        Document copy = new Document(original);

        // Assert
        Template copiedTemplate = copy.findTemplate("P").orElseThrow();
        assertThat(copiedTemplate).isNotSameAs(template);
        assertThat(copiedTemplate.getSymbol()).isSameAs(template.getSymbol());
        assertThat(copy.getProcesses()).singleElement().satisfies(p -> {
            assertThat(p).isNotSameAs(process);
            assertThat(p.getTemplate()).isSameAs(copiedTemplate);
        });
        assertThat(copy.getInstances().get(0)).isSameAs(copy.getProcesses().get(0));
        Template copiedChart = copy.findTemplate("C").orElseThrow();
        assertThat(copiedChart.getInstanceLines().get(0).getInstance().getTemplate()).isSameAs(copiedTemplate);
        assertThat(chart.getInstanceLines().get(0).getInstance().getTemplate()).isSameAs(template);
        assertThat(copy.getProcPriority("P1")).isEqualTo(2);
        assertThat(copy.getErrors()).hasSize(1);
    }

    /**
     * Changes to the copy do not show in the original.
     */
    @Test
    void copyIsIndependent() {
        // Arrange
        Document copy = new Document(original);
        Template copiedTemplate = copy.findTemplate("P").orElseThrow();

        // Act
        copiedTemplate.addLocation("busy", Expression.EMPTY, Expression.EMPTY, Position.UNKNOWN);
        copiedTemplate.getStates().get(0).setInvariant(Expression.constant("x <= 1"));
        copy.addVariable(copy.getGlobals(), Type.of(Type.Kind.INT), "y", Expression.EMPTY, Position.UNKNOWN);
        copy.getGlobals().findVariable("x").orElseThrow().setInitializer(Expression.constant("0"));
        copy.removeProcess(copy.getProcesses().get(0));
        copy.addError(Position.UNKNOWN, "later", "");

        // Assert
        assertThat(template.getStates()).extracting(State::getInvariant).containsExactly(Expression.EMPTY);
        assertThat(original.getGlobals().getFrame().contains("y")).isFalse();
        assertThat(original.getGlobals().findVariable("x").orElseThrow().getInitializer()).isEqualTo(Expression.EMPTY);
        assertThat(original.getProcesses()).containsExactly(process);
        assertThat(original.getErrors()).hasSize(1);
    }

    /**
     * Traversing the copy yields the copy's entities even though symbols are shared.
     */
    @Test
    void visitorSeesCopiedEntities() {
        // Arrange
        Document copy = new Document(original);
        List<Object> visited = new ArrayList<>();
        SystemVisitor collector = new SystemVisitor() {
            @Override
            public void visitVariable(Variable variable) {
                visited.add(variable);
            }

            @Override
            public void visitState(State state) {
                visited.add(state);
            }

            @Override
            public void visitInstance(Instance instance) {
                visited.add(instance);
            }
        };

        // Act
        copy.accept(collector);

        // Assert
        assertThat(visited).hasSize(3);
        assertThat(visited.get(0)).isSameAs(copy.getGlobals().findVariable("x").orElseThrow());
        assertThat(visited.get(1)).isSameAs(copy.getInstances().get(0));
        assertThat(visited.get(2)).isSameAs(copy.findTemplate("P").orElseThrow().getStates().get(0));
        assertThat(visited).doesNotContain(original.getGlobals().findVariable("x").orElseThrow());
    }

    /**
     * Chart events of the copy are anchored at the copy's own instance lines, and the
     * original refuses the copy's handles.
     */
    @Test
    void copiedChartUsesItsOwnInstanceLines() {
        // Arrange
        InstanceLine line = chart.getInstanceLines().get(0);
        chart.addUpdate(line.getSymbol(), 1, false);
        Document copy = new Document(original);
        Template copiedChart = copy.findTemplate("C").orElseThrow();

        // Act
        Result<Message> message = copiedChart.addMessage(line.getSymbol(), line.getSymbol(), 2, true);

        // Assert
        Handle<InstanceLine> copiedLine = copiedChart.getScenario().resolveLine(line.getSymbol()).orElseThrow();
        assertThat(copiedLine).isNotEqualTo(line.getHandle());
        assertThat(copiedChart.getScenario().getUpdates()).singleElement()
                .satisfies(u -> assertThat(u.anchor()).isEqualTo(copiedLine));
        assertThat(message.isOk()).isTrue();
        assertThat(copiedChart.getSimregions()).hasSize(2);
        assertThat(chart.getScenario().getMessages()).isEmpty();
        assertThat(chart.hasPrechart()).isFalse();
        assertThatThrownBy(() -> chart.getScenario().getInstanceLine(copiedLine))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
