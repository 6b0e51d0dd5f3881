package net.katagaitai.sashikae.diff;

import com.google.common.collect.ImmutableList;
import lombok.Value;
import net.katagaitai.sashikae.model.Function;
import net.katagaitai.sashikae.model.variable.StateVariable;

import java.util.List;

// 2つのバージョンのコントラクトの比較結果。各リストは発見順に並ぶ。
@Value
public class DiffResult {
    private List<StateVariable> missingVariables;
    private List<StateVariable> newVariables;
    private List<StateVariable> taintedVariables;
    private List<Function> newFunctions;
    private List<Function> modifiedFunctions;
    private List<Function> taintedFunctions;

    public DiffResult(List<StateVariable> missingVariables,
                      List<StateVariable> newVariables,
                      List<StateVariable> taintedVariables,
                      List<Function> newFunctions,
                      List<Function> modifiedFunctions,
                      List<Function> taintedFunctions) {
        this.missingVariables = ImmutableList.copyOf(missingVariables);
        this.newVariables = ImmutableList.copyOf(newVariables);
        this.taintedVariables = ImmutableList.copyOf(taintedVariables);
        this.newFunctions = ImmutableList.copyOf(newFunctions);
        this.modifiedFunctions = ImmutableList.copyOf(modifiedFunctions);
        this.taintedFunctions = ImmutableList.copyOf(taintedFunctions);
    }

    public boolean isEmpty() {
        return missingVariables.isEmpty()
                && newVariables.isEmpty()
                && taintedVariables.isEmpty()
                && newFunctions.isEmpty()
                && modifiedFunctions.isEmpty()
                && taintedFunctions.isEmpty();
    }
}
