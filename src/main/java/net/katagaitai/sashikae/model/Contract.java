package net.katagaitai.sashikae.model;

import com.google.common.collect.Lists;
import lombok.Getter;
import lombok.Setter;
import net.katagaitai.sashikae.model.variable.StateVariable;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

// コントラクト。状態変数は継承を含めた宣言順に並ぶ。
public class Contract {
    @Getter
    private final String name;
    private final List<StateVariable> stateVariablesOrdered = Lists.newArrayList();
    private final List<Function> functions = Lists.newArrayList();
    @Getter
    @Setter
    private Function fallbackFunction;
    @Getter
    @Setter
    private boolean upgradeableProxy;

    public Contract(String name) {
        this.name = name;
    }

    public List<StateVariable> getStateVariablesOrdered() {
        return Collections.unmodifiableList(stateVariablesOrdered);
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public Contract addStateVariable(StateVariable variable) {
        stateVariablesOrdered.add(variable);
        return this;
    }

    public Contract addFunction(Function function) {
        functions.add(function);
        return this;
    }

    public Function getFunctionFromSignature(String signature) {
        return functions.stream()
                .filter(f -> f.getSignature().equals(signature))
                .findFirst()
                .orElse(null);
    }

    public StateVariable getStateVariableFromName(String name) {
        return stateVariablesOrdered.stream()
                .filter(v -> Objects.equals(v.getName(), name))
                .findFirst()
                .orElse(null);
    }

    public List<Function> getFunctionsReadingFromVariable(StateVariable variable) {
        return functions.stream()
                .filter(f -> f.getStateVariablesRead().contains(variable))
                .collect(Collectors.toList());
    }

    public List<Function> getFunctionsWritingToVariable(StateVariable variable) {
        return functions.stream()
                .filter(f -> f.getStateVariablesWritten().contains(variable))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return name;
    }
}
