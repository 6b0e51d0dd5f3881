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

import java.util.Collection;
import java.util.List;
import java.util.Set;

@Slf4j(topic = "sashikae")
public class TaintPropagator {
    @Getter
    @Setter
    private String syntheticFunctionPrefix = Constants.SYNTHETIC_FUNCTION_PREFIX;

    // changedFunctionsを呼ぶか、同じ可変の状態変数を読み書きする関数。v2の列挙順
    public List<Function> findTaintedFunctions(Contract v2, Collection<Function> changedFunctions) {
        Set<StateVariable> taintedVariables = Sets.newLinkedHashSet();
        for (Function function : changedFunctions) {
            taintedVariables.addAll(function.getStateVariablesRead());
            taintedVariables.addAll(function.getStateVariablesWritten());
        }

        List<Function> result = Lists.newArrayList();
        for (Function function : v2.getFunctions()) {
            if (changedFunctions.contains(function)
                    || function.isConstructor()
                    || function.getName().startsWith(syntheticFunctionPrefix)) {
                continue;
            }
            boolean callsChanged = function.getInternalCalls().stream().anyMatch(changedFunctions::contains);
            Set<StateVariable> touched = function.getStateVariablesReadOrWritten();
            boolean sharesVariable = taintedVariables.stream()
                    .filter(StateVariable::isMutable)
                    .anyMatch(touched::contains);
            if (callsChanged || sharesVariable) {
                log.debug("汚染された関数: {} (call={}, variable={})", function, callsChanged, sharesVariable);
                result.add(function);
            }
        }
        return result;
    }

    public List<StateVariable> findTaintedVariables(Contract v2, List<StateVariable> candidates,
                                                    Collection<Function> changedFunctions) {
        List<StateVariable> result = Lists.newArrayList();
        for (StateVariable variable : candidates) {
            List<Function> readBy = v2.getFunctionsReadingFromVariable(variable);
            List<Function> writtenBy = v2.getFunctionsWritingToVariable(variable);
            if (changedFunctions.stream().anyMatch(f -> readBy.contains(f) || writtenBy.contains(f))) {
                log.debug("汚染された変数: {}", variable);
                result.add(variable);
            }
        }
        return result;
    }
}
