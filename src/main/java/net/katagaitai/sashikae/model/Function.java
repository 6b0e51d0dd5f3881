package net.katagaitai.sashikae.model;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import lombok.Getter;
import lombok.Setter;
import net.katagaitai.sashikae.model.cfg.Node;
import net.katagaitai.sashikae.model.variable.LocalVariable;
import net.katagaitai.sashikae.model.variable.StateVariable;
import net.katagaitai.sashikae.model.variable.Variable;

import java.util.Collections;
import java.util.List;
import java.util.Set;

// コントラクトの関数。nodesの先頭がエントリーポイント。
public class Function {
    @Getter
    private final String name;
    // withdraw(uint256) のような正規化されたシグネチャ
    @Getter
    private final String signature;
    // ソーステキストのハッシュ
    @Getter
    @Setter
    private String contentHash;
    @Getter
    @Setter
    private boolean constructor;
    // 状態変数の初期化用にフロントエンドが生成した関数
    @Getter
    @Setter
    private boolean constructorVariables;

    private final List<Node> nodes = Lists.newArrayList();
    private final List<Function> internalCalls = Lists.newArrayList();
    private final List<StateVariable> stateVariablesRead = Lists.newArrayList();
    private final List<StateVariable> stateVariablesWritten = Lists.newArrayList();
    private final List<Variable> variablesRead = Lists.newArrayList();
    private final List<Variable> variablesWritten = Lists.newArrayList();
    private final List<LocalVariable> localVariables = Lists.newArrayList();
    private final List<LocalVariable> parameters = Lists.newArrayList();
    private final List<LocalVariable> returns = Lists.newArrayList();

    public Function(String name, String signature) {
        this.name = name;
        this.signature = signature;
    }

    public Node getEntryPoint() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Function> getInternalCalls() {
        return Collections.unmodifiableList(internalCalls);
    }

    public List<StateVariable> getStateVariablesRead() {
        return Collections.unmodifiableList(stateVariablesRead);
    }

    public List<StateVariable> getStateVariablesWritten() {
        return Collections.unmodifiableList(stateVariablesWritten);
    }

    public List<LocalVariable> getLocalVariables() {
        return Collections.unmodifiableList(localVariables);
    }

    public List<LocalVariable> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public List<LocalVariable> getReturns() {
        return Collections.unmodifiableList(returns);
    }

    public Set<StateVariable> getStateVariablesReadOrWritten() {
        Set<StateVariable> result = Sets.newLinkedHashSet(stateVariablesRead);
        result.addAll(stateVariablesWritten);
        return result;
    }

    public Set<Variable> getVariablesReadOrWritten() {
        Set<Variable> result = Sets.newLinkedHashSet(variablesRead);
        result.addAll(variablesWritten);
        return result;
    }

    public boolean isContainsAssembly() {
        return nodes.stream().anyMatch(Node::isAssembly);
    }

    public Function addNode(Node node) {
        node.setFunction(this);
        nodes.add(node);
        return this;
    }

    public Function addInternalCall(Function callee) {
        internalCalls.add(callee);
        return this;
    }

    public Function addRead(Variable variable) {
        variablesRead.add(variable);
        if (variable instanceof StateVariable) {
            stateVariablesRead.add((StateVariable) variable);
        }
        return this;
    }

    public Function addWrite(Variable variable) {
        variablesWritten.add(variable);
        if (variable instanceof StateVariable) {
            stateVariablesWritten.add((StateVariable) variable);
        }
        return this;
    }

    public Function addLocalVariable(LocalVariable variable) {
        localVariables.add(variable);
        return this;
    }

    public Function addParameter(LocalVariable variable) {
        parameters.add(variable);
        return this;
    }

    public Function addReturn(LocalVariable variable) {
        returns.add(variable);
        return this;
    }

    @Override
    public String toString() {
        return signature;
    }
}
