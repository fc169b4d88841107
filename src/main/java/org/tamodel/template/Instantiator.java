package org.tamodel.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tamodel.diagnostics.Result;
import org.tamodel.diagnostics.TypeError;
import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Frame;
import org.tamodel.symbols.Symbol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds arguments to the free parameters of an instance, producing a new (partial or
 * complete) instance. The base instance is never modified.
 * <p>
 * Argument {@code i} binds the {@code i}-th free parameter of the base. The frame of
 * the result lists, in this order: the fresh parameters introduced by the
 * instantiation, the base's parameters that stay free, the base's bound parameters
 * and finally the parameters bound now. Binding {@code [a]} and then {@code [b]}
 * therefore yields the same mapping and frame as binding {@code [a, b]} at once.
 */
public final class Instantiator {

    private static final Logger LOG = LoggerFactory.getLogger(Instantiator.class);

    private Instantiator() {}

    /**
     * Instantiates {@code base}.
     *
     * @param symbol    The name of the new instance.
     * @param base      The template or instance being instantiated.
     * @param params    The parameters of the instantiation. Symbols that are already
     *                  parameters of {@code base} are ignored; the others become fresh
     *                  free parameters of the new instance.
     * @param arguments The arguments, bound left to right to the free parameters of {@code base}.
     * @return The new instance, or {@link TypeError.Kind#TOO_MANY_ARGUMENTS} if
     *         {@code base} has fewer free parameters than {@code arguments}.
     */
    public static Result<Instance> instantiate(Symbol symbol, Instance base, Frame params,
                                               List<Expression> arguments) {
        if (arguments.size() > base.getUnbound()) {
            LOG.debug("Rejecting {} arguments for {} with {} unbound parameters",
                    arguments.size(), base.getName(), base.getUnbound());
            return Result.error(TypeError.tooManyArguments(base.getName()));
        }

        Frame baseParameters = base.getParameters();
        List<Symbol> fresh = new ArrayList<>();
        for (Symbol parameter : params) {
            if (!baseParameters.contains(parameter)) {
                fresh.add(parameter);
            }
        }

        int bindCount = arguments.size();
        Frame parameters = new Frame();
        fresh.forEach(parameters::add);
        for (int i = bindCount; i < base.getUnbound(); i++) {
            parameters.add(baseParameters.get(i));
        }
        for (int i = base.getUnbound(); i < baseParameters.size(); i++) {
            parameters.add(baseParameters.get(i));
        }
        for (int i = 0; i < bindCount; i++) {
            parameters.add(baseParameters.get(i));
        }

        Map<Symbol, Expression> mapping = new LinkedHashMap<>(base.getMapping());
        for (int i = 0; i < bindCount; i++) {
            mapping.put(baseParameters.get(i), arguments.get(i));
        }

        int unbound = fresh.size() + base.getUnbound() - bindCount;
        Set<Symbol> restricted = propagateRestrictions(base, baseParameters, parameters, unbound, arguments);

        Instance instance = new Instance(symbol, parameters, mapping, base.getArguments() + bindCount,
                unbound, base.getTemplate(), restricted);
        LOG.debug("Instantiated {} from {}: {} unbound, mapping [{}]",
                instance.getName(), base.getName(), unbound, instance.writeMapping());
        return Result.ok(instance);
    }

    /**
     * An argument bound to a restricted parameter restricts the free parameters of the
     * new instance it refers to. Arguments without such references add nothing.
     */
    private static Set<Symbol> propagateRestrictions(Instance base, Frame baseParameters, Frame parameters,
                                                     int unbound, List<Expression> arguments) {
        Set<Symbol> restricted = new LinkedHashSet<>(base.getRestricted());
        for (int i = 0; i < arguments.size(); i++) {
            Symbol parameter = baseParameters.get(i);
            if (!base.isRestricted(parameter)) continue;
            for (Symbol referenced : arguments.get(i).symbols()) {
                int index = parameters.indexOf(referenced);
                if (index >= 0 && index < unbound) {
                    restricted.add(referenced);
                }
            }
        }
        return restricted;
    }
}
