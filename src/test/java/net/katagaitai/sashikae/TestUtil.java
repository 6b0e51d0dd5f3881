package net.katagaitai.sashikae;

import com.google.common.collect.Lists;
import net.katagaitai.sashikae.model.Function;
import net.katagaitai.sashikae.model.cfg.Node;
import net.katagaitai.sashikae.model.cfg.NodeType;
import net.katagaitai.sashikae.model.ir.Operation;

import java.util.List;

public class TestUtil {
    public static final String IMPLEMENTATION_SLOT_HEX =
            "0x360894a13ba1a3210667c828492db98dca3e2076cc3735a920a3ca505d382bbc";

    /**
     * ENTRYPOINTノードの後に、irsごとに1つずつEXPRESSIONノードを直列につないだ関数を作る。
     */
    @SafeVarargs
    public static Function newFunction(String name, String contentHash, List<Operation>... irs) {
        Function function = new Function(name, name + "()");
        function.setContentHash(contentHash);
        Node prev = new Node(0, NodeType.ENTRYPOINT);
        function.addNode(prev);
        int id = 1;
        for (List<Operation> nodeIrs : irs) {
            Node node = new Node(id++, NodeType.EXPRESSION);
            for (Operation ir : nodeIrs) {
                node.addIr(ir);
            }
            prev.addSon(node);
            function.addNode(node);
            prev = node;
        }
        return function;
    }

    public static List<Operation> irs(Operation... operations) {
        return Lists.newArrayList(operations);
    }

    public static Node newAssemblyNode(int id, String asm) {
        Node node = new Node(id, NodeType.ASSEMBLY);
        node.setInlineAsm(asm);
        return node;
    }

    public static String repeat(String s, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
