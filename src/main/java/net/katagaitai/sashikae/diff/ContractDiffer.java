package net.katagaitai.sashikae.diff;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.sashikae.model.Contract;
import net.katagaitai.sashikae.model.Function;
import net.katagaitai.sashikae.model.variable.StateVariable;
import net.katagaitai.sashikae.util.Constants;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

@Slf4j(topic = "sashikae")
public class ContractDiffer {
    @Getter
    @Setter
    private String constructorVariablesPrefix = Constants.CONSTRUCTOR_VARIABLES_PREFIX;
    private final TaintPropagator taintPropagator = new TaintPropagator();

    public void setSyntheticFunctionPrefix(String prefix) {
        taintPropagator.setSyntheticFunctionPrefix(prefix);
    }

    public DiffResult compare(Contract v1, Contract v2) {
        checkNotNull(v1);
        checkNotNull(v2);
        List<StateVariable> orderVars2 = getMutableVariables(v2);

        // 検出器ではないので、v2で消えた変数もすべて含める
        List<StateVariable> missingVariables = getMissingVariables(v1, v2);

        List<Function> newFunctions = Lists.newArrayList();
        List<Function> modifiedFunctions = Lists.newArrayList();
        // 追加・変更された関数を列挙順のまま保持する
        Set<Function> changedFunctions = Sets.newLinkedHashSet();
        for (Function function : v2.getFunctions()) {
            Function origFunction = v1.getFunctionFromSignature(function.getSignature());
            if (origFunction == null) {
                newFunctions.add(function);
                changedFunctions.add(function);
            } else if (!isConstructorVariables(function) && FunctionComparator.isModified(origFunction, function)) {
                modifiedFunctions.add(function);
                changedFunctions.add(function);
            }
        }

        List<Function> taintedFunctions = taintPropagator.findTaintedFunctions(v2, changedFunctions);

        List<StateVariable> newVariables = Lists.newArrayList();
        List<StateVariable> candidates = Lists.newArrayList();
        for (StateVariable variable : orderVars2) {
            if (v1.getStateVariableFromName(variable.getName()) == null) {
                newVariables.add(variable);
            } else {
                candidates.add(variable);
            }
        }
        Set<Function> affectedFunctions = Sets.newLinkedHashSet(changedFunctions);
        affectedFunctions.addAll(taintedFunctions);
        List<StateVariable> taintedVariables =
                taintPropagator.findTaintedVariables(v2, candidates, affectedFunctions);

        DiffResult result = new DiffResult(missingVariables, newVariables, taintedVariables,
                newFunctions, modifiedFunctions, taintedFunctions);
        log.info("{} -> {}: missing={}, new vars={}, tainted vars={}, new funcs={}, modified funcs={}, tainted funcs={}",
                v1, v2,
                missingVariables.size(), newVariables.size(), taintedVariables.size(),
                newFunctions.size(), modifiedFunctions.size(), taintedFunctions.size());
        return result;
    }

    // v1にあってv2にない可変の状態変数。v2の変数の数がv1より少ない場合のみ探す。
    public List<StateVariable> getMissingVariables(Contract v1, Contract v2) {
        List<StateVariable> orderVars1 = getMutableVariables(v1);
        List<StateVariable> orderVars2 = getMutableVariables(v2);
        List<StateVariable> result = Lists.newArrayList();
        if (orderVars2.size() < orderVars1.size()) {
            Set<String> names2 = orderVars2.stream().map(StateVariable::getName).collect(Collectors.toSet());
            for (StateVariable variable : orderVars1) {
                if (!names2.contains(variable.getName())) {
                    result.add(variable);
                }
            }
        }
        return result;
    }

    private boolean isConstructorVariables(Function function) {
        return function.isConstructorVariables() || function.getName().startsWith(constructorVariablesPrefix);
    }

    private static List<StateVariable> getMutableVariables(Contract contract) {
        return contract.getStateVariablesOrdered().stream()
                .filter(StateVariable::isMutable)
                .collect(Collectors.toList());
    }
}
