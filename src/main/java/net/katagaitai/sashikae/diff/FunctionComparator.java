package net.katagaitai.sashikae.diff;

import com.google.common.collect.Sets;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.sashikae.model.Function;
import net.katagaitai.sashikae.model.cfg.Node;
import net.katagaitai.sashikae.model.ir.Operation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

@Slf4j(topic = "sashikae")
public class FunctionComparator {

    // CFGの形が違う場合も変更ありとする
    public static boolean isModified(Function f1, Function f2) {
        checkNotNull(f1);
        checkNotNull(f2);
        if (f1 == f2) {
            return false;
        }
        if (f1.getContentHash() != null && f1.getContentHash().equals(f2.getContentHash())) {
            log.debug("ハッシュ一致: {}", f2);
            return false;
        }
        // コメントや変数名だけの変更かもしれないのでIRを比較する
        Node entry1 = f1.getEntryPoint();
        Node entry2 = f2.getEntryPoint();
        if (entry1 == null || entry2 == null) {
            return entry1 != entry2;
        }

        Deque<Node> queue1 = new ArrayDeque<>();
        Deque<Node> queue2 = new ArrayDeque<>();
        Set<Node> visited1 = Sets.newIdentityHashSet();
        Set<Node> visited2 = Sets.newIdentityHashSet();
        queue1.add(entry1);
        queue2.add(entry2);
        visited1.add(entry1);
        visited2.add(entry2);
        while (!queue1.isEmpty() && !queue2.isEmpty()) {
            Node node1 = queue1.poll();
            Node node2 = queue2.poll();
            if (node1.getSons().size() != node2.getSons().size()) {
                log.debug("分岐数の不一致: {} {} / {} {}", f1, node1, f2, node2);
                return true;
            }
            enqueueSons(node1, queue1, visited1);
            enqueueSons(node2, queue2, visited2);

            List<Operation> irs1 = node1.getIrs();
            List<Operation> irs2 = node2.getIrs();
            if (irs1.size() != irs2.size()) {
                log.debug("IR数の不一致: {} {} / {} {}", f1, node1, f2, node2);
                return true;
            }
            for (int i = 0; i < irs1.size(); i++) {
                String e1 = IrEncoder.encodeOperation(irs1.get(i));
                String e2 = IrEncoder.encodeOperation(irs2.get(i));
                if (!e1.equals(e2)) {
                    log.debug("IRの不一致: {} / {}", e1, e2);
                    return true;
                }
            }
        }
        if (!queue1.isEmpty() || !queue2.isEmpty()) {
            log.warn("ノード数の不一致: {}", f2);
            return true;
        }
        return false;
    }

    private static void enqueueSons(Node node, Deque<Node> queue, Set<Node> visited) {
        for (Node son : node.getSons()) {
            if (visited.add(son)) {
                queue.add(son);
            }
        }
    }
}
