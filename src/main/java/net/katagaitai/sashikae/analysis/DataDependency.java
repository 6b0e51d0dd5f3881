package net.katagaitai.sashikae.analysis;

import net.katagaitai.sashikae.model.Contract;
import net.katagaitai.sashikae.model.variable.Variable;

import java.util.List;

public interface DataDependency {
    // 依存がなければ空リスト
    List<Variable> getDependencies(Variable variable, Contract contract);
}
