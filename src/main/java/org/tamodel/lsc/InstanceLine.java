package org.tamodel.lsc;

import org.tamodel.arena.Handle;
import org.tamodel.diagnostics.Result;
import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Frame;
import org.tamodel.symbols.Symbol;
import org.tamodel.template.Instance;
import org.tamodel.template.Instantiator;
import org.tamodel.template.Template;

import java.util.List;
import java.util.Map;

/**
 * An actor lane of a live sequence chart. An instance line starts out as an empty
 * instance of its chart and is later bound to the template instance it observes
 * with {@link #addParameters}.
 */
public final class InstanceLine {

    private final Handle<InstanceLine> handle;
    private final Symbol symbol;
    private Instance instance;

    /**
     * Creates an instance line.
     * @param handle The handle of the line within its chart.
     * @param symbol The symbol of the line.
     * @param chart The template of the chart the line belongs to.
     */
    public InstanceLine(Handle<InstanceLine> handle, Symbol symbol, Template chart) {
        this.handle = handle;
        this.symbol = symbol;
        this.instance = Instance.unbound(symbol, new Frame(), chart);
    }

    private InstanceLine(InstanceLine other, Handle<InstanceLine> handle) {
        this.handle = handle;
        this.symbol = other.symbol;
        this.instance = other.instance;
    }

    InstanceLine copy(Handle<InstanceLine> handle) {
        return new InstanceLine(this, handle);
    }

    /**
     * Points the instance of a copied line at the copied templates.
     * @param copies Original templates mapped to their copies.
     */
    void relink(Map<Template, Template> copies) {
        Template target = copies.get(instance.getTemplate());
        if (target != null) {
            instance = instance.copyFor(target);
        }
    }

    public Handle<InstanceLine> getHandle() {
        return handle;
    }

    /** @return The position of this line within its chart's instance-line sequence. */
    public int getNumber() {
        return handle.index();
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public String getName() {
        return symbol.getName();
    }

    public Instance getInstance() {
        return instance;
    }

    /**
     * Binds this line to an instance of the observed template.
     *
     * @param base      The observed template or instance.
     * @param params    Fresh parameters of the binding.
     * @param arguments Arguments for the free parameters of {@code base}.
     * @return The new instance of this line, or the error that left it unchanged. The
     *         error is not reported; see {@link org.tamodel.document.Document#bindInstanceLine}.
     */
    public Result<Instance> addParameters(Instance base, Frame params, List<Expression> arguments) {
        Result<Instance> result = Instantiator.instantiate(symbol, base, params, arguments);
        result.value().ifPresent(bound -> instance = bound);
        return result;
    }

    /**
     * Selects the simregions this line takes part in.
     * @param simregions The simregions of the chart.
     * @return The simregions touching this line, in the given order.
     */
    public List<Simregion> getSimregions(List<Simregion> simregions) {
        return simregions.stream().filter(s -> s.touches(handle)).toList();
    }

    @Override
    public String toString() {
        return symbol.getName();
    }
}
