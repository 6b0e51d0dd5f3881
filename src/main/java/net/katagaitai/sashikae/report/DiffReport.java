package net.katagaitai.sashikae.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import net.katagaitai.sashikae.analysis.SlotInfo;
import net.katagaitai.sashikae.diff.DiffResult;
import net.katagaitai.sashikae.model.Function;
import net.katagaitai.sashikae.model.variable.Variable;

import java.util.List;
import java.util.stream.Collectors;

@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiffReport {
    @Getter
    private final String name;
    @Getter
    private final String v1;
    @Getter
    private final String v2;
    @Getter
    private final List<String> missingVariables;
    @Getter
    private final List<String> newVariables;
    @Getter
    private final List<String> taintedVariables;
    @Getter
    private final List<String> newFunctions;
    @Getter
    private final List<String> modifiedFunctions;
    @Getter
    private final List<String> taintedFunctions;
    // プロキシを指定しなかった場合はnull
    @Getter
    private final SlotInfo implementationSlot;

    public DiffReport(String v1, String v2, DiffResult result, SlotInfo implementationSlot) {
        this.name = v1 + "_" + v2;
        this.v1 = v1;
        this.v2 = v2;
        this.missingVariables = variableNames(result.getMissingVariables());
        this.newVariables = variableNames(result.getNewVariables());
        this.taintedVariables = variableNames(result.getTaintedVariables());
        this.newFunctions = signatures(result.getNewFunctions());
        this.modifiedFunctions = signatures(result.getModifiedFunctions());
        this.taintedFunctions = signatures(result.getTaintedFunctions());
        this.implementationSlot = implementationSlot;
    }

    private static List<String> variableNames(List<? extends Variable> variables) {
        return variables.stream().map(Variable::getName).collect(Collectors.toList());
    }

    private static List<String> signatures(List<Function> functions) {
        return functions.stream().map(Function::getSignature).collect(Collectors.toList());
    }
}
