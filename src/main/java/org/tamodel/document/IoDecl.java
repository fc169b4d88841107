package org.tamodel.document;

import org.tamodel.symbols.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * An I/O declaration of a process, used for test generation and refinement
 * checking: the process's input and output channels and its CSP channels.
 */
public final class IoDecl {

    private String instanceName = "";
    private final List<Expression> parameters = new ArrayList<>();
    private final List<Expression> inputs = new ArrayList<>();
    private final List<Expression> outputs = new ArrayList<>();
    private final List<Expression> csp = new ArrayList<>();

    public IoDecl() {}

    IoDecl(IoDecl other) {
        this.instanceName = other.instanceName;
        this.parameters.addAll(other.parameters);
        this.inputs.addAll(other.inputs);
        this.outputs.addAll(other.outputs);
        this.csp.addAll(other.csp);
    }

    public String getInstanceName() {
        return instanceName;
    }

    public void setInstanceName(String instanceName) {
        this.instanceName = instanceName;
    }

    public List<Expression> getParameters() {
        return parameters;
    }

    public List<Expression> getInputs() {
        return inputs;
    }

    public List<Expression> getOutputs() {
        return outputs;
    }

    public List<Expression> getCsp() {
        return csp;
    }
}
