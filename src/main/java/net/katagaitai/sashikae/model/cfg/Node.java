package net.katagaitai.sashikae.model.cfg;

import com.google.common.collect.Lists;
import lombok.Getter;
import lombok.Setter;
import net.katagaitai.sashikae.model.Function;
import net.katagaitai.sashikae.model.expression.Expression;
import net.katagaitai.sashikae.model.ir.Operation;

import java.util.Collections;
import java.util.List;

// CFGのノード。同一性はインスタンスで判定する。
public class Node {
    @Getter
    private final int nodeId;
    @Getter
    private final NodeType type;
    private final List<Operation> irs = Lists.newArrayList();
    private final List<Node> sons = Lists.newArrayList();
    @Getter
    @Setter
    private Expression expression;
    // ASSEMBLYノードのインラインアセンブリ
    @Getter
    @Setter
    private String inlineAsm;
    @Getter
    @Setter
    private Function function;

    public Node(int nodeId, NodeType type) {
        this.nodeId = nodeId;
        this.type = type;
    }

    public List<Operation> getIrs() {
        return Collections.unmodifiableList(irs);
    }

    public List<Node> getSons() {
        return Collections.unmodifiableList(sons);
    }

    public Node addIr(Operation ir) {
        irs.add(ir);
        return this;
    }

    public Node addSon(Node son) {
        sons.add(son);
        return this;
    }

    public boolean isAssembly() {
        return type == NodeType.ASSEMBLY && inlineAsm != null;
    }

    @Override
    public String toString() {
        return "Node{" + nodeId + " " + type + "}";
    }
}
