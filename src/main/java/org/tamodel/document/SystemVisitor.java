package org.tamodel.document;

import org.tamodel.lsc.Condition;
import org.tamodel.lsc.InstanceLine;
import org.tamodel.lsc.Message;
import org.tamodel.lsc.Update;
import org.tamodel.symbols.Symbol;
import org.tamodel.template.Edge;
import org.tamodel.template.Instance;
import org.tamodel.template.State;
import org.tamodel.template.Template;

/**
 * Callbacks for {@link Document#accept(SystemVisitor)}. Every hook does nothing by
 * default, so a pass only overrides what it needs.
 */
public interface SystemVisitor {

    default void visitSystemBefore(Document document) {}

    default void visitSystemAfter(Document document) {}

    default void visitVariable(Variable variable) {}

    default void visitFunction(Function function) {}

    default void visitTypeDef(Symbol typeDef) {}

    /** Called for partial instances and LSC instances declared in the global frame. */
    default void visitInstance(Instance instance) {}

    /**
     * Called before the body of a template is traversed.
     * @param template The template.
     * @return {@code false} to skip the body and {@link #visitTemplateAfter}.
     */
    default boolean visitTemplateBefore(Template template) {
        return true;
    }

    default void visitTemplateAfter(Template template) {}

    default void visitState(State state) {}

    default void visitEdge(Edge edge) {}

    default void visitInstanceLine(InstanceLine line) {}

    default void visitMessage(Message message) {}

    default void visitCondition(Condition condition) {}

    default void visitUpdate(Update update) {}

    default void visitProcess(Instance process) {}

    default void visitProgressMeasure(ProgressMeasure measure) {}

    default void visitIoDecl(IoDecl decl) {}

    default void visitGanttChart(Gantt gantt) {}
}
