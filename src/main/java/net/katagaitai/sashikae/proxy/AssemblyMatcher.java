package net.katagaitai.sashikae.proxy;

import com.google.common.base.Splitter;
import com.google.common.collect.Sets;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.sashikae.analysis.SlotInfo;
import net.katagaitai.sashikae.analysis.StorageLayout;
import net.katagaitai.sashikae.model.Contract;
import net.katagaitai.sashikae.model.Function;
import net.katagaitai.sashikae.model.cfg.Node;
import net.katagaitai.sashikae.model.expression.Expression;
import net.katagaitai.sashikae.model.expression.Identifier;
import net.katagaitai.sashikae.model.variable.LocalVariable;
import net.katagaitai.sashikae.model.variable.StateVariable;
import net.katagaitai.sashikae.model.variable.Variable;
import net.katagaitai.sashikae.proxy.asm.AsmExpression;
import net.katagaitai.sashikae.proxy.asm.AsmParseException;
import net.katagaitai.sashikae.proxy.asm.AsmParser;
import net.katagaitai.sashikae.util.Constants;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.Set;

// 古いsolcのASSEMBLYノードはアセンブリ全体が1つの文字列になっている
@Slf4j(topic = "sashikae")
public class AssemblyMatcher {
    private static final Splitter LINE_SPLITTER = Splitter.on('\n');

    // nullならスロット番号による検索はしない
    private final StorageLayout storageLayout;

    public AssemblyMatcher(StorageLayout storageLayout) {
        this.storageLayout = storageLayout;
    }

    // delegatecallの第2引数(アドレス)
    public DelegateResolution extractDelegate(Contract contract, Node node) {
        String line = findLine(node.getInlineAsm(), Constants.DELEGATECALL);
        if (line == null) {
            return DelegateResolution.notFound();
        }
        AsmExpression call;
        try {
            call = AsmParser.findCall(line, Constants.DELEGATECALL).orElse(null);
        } catch (AsmParseException e) {
            log.debug("アセンブリの解析失敗: {}", line, e);
            return DelegateResolution.notFound();
        }
        if (call == null || call.getArguments().size() < 2) {
            log.debug("delegatecallの呼び出しではない: {}", line);
            return DelegateResolution.notFound();
        }
        log.debug("delegatecall: {}", call);

        Function function = node.getFunction();
        AsmExpression dest = call.getArguments().get(1);
        if (dest.isCall(Constants.SLOAD)) {
            if (dest.getArguments().size() != 1) {
                return DelegateResolution.notFound();
            }
            return DelegateResolution.of(resolveSload(contract, dest.getArguments().get(0), function));
        }
        if (dest.getKind() != AsmExpression.Kind.IDENTIFIER) {
            return DelegateResolution.notFound();
        }
        return DelegateResolution.of(findDelegateFromName(contract, stripSuffix(dest.getText()), function));
    }

    private Optional<? extends Variable> resolveSload(Contract contract, AsmExpression slot, Function function) {
        switch (slot.getKind()) {
            case HEX:
                return SlotVariableFactory.create(slot.getText());
            case NUMBER:
                return findVariableAtSlot(contract, new BigInteger(slot.getText()));
            case IDENTIFIER:
                Optional<StateVariable> constant = findConstantSlot(slot.getText(), function);
                if (constant.isPresent()) {
                    return constant;
                }
                return findDelegateFromName(contract, slot.getText(), function);
            default:
                return Optional.empty();
        }
    }

    // 関数が読み書きする変数のうち、スロットを表す定数を探す
    private Optional<StateVariable> findConstantSlot(String name, Function function) {
        if (function == null) {
            return Optional.empty();
        }
        for (Variable v : function.getVariablesReadOrWritten()) {
            if (!name.equals(v.getName())) {
                continue;
            }
            if (v instanceof LocalVariable) {
                // bytes32 slot = IMPLEMENTATION_SLOT; のような別名
                Expression e = ((LocalVariable) v).getExpression();
                if (e instanceof Identifier && ((Identifier) e).getValue() instanceof StateVariable) {
                    v = ((Identifier) e).getValue();
                }
            }
            if (v instanceof StateVariable && ((StateVariable) v).isConstant()) {
                return Optional.of((StateVariable) v);
            }
        }
        return Optional.empty();
    }

    // 状態変数、ローカル変数、引数、戻り値の順。なければ "name := sload(slot)" の行から探す
    public Optional<Variable> findDelegateFromName(Contract contract, String name, Function function) {
        return findDelegateFromName(contract, name, function, Sets.newHashSet());
    }

    private Optional<Variable> findDelegateFromName(Contract contract, String name, Function function,
                                                    Set<String> visited) {
        if (!visited.add(name)) {
            return Optional.empty();
        }
        for (StateVariable sv : contract.getStateVariablesOrdered()) {
            if (name.equals(sv.getName())) {
                return Optional.of(sv);
            }
        }
        if (function == null) {
            return Optional.empty();
        }
        for (LocalVariable lv : function.getLocalVariables()) {
            if (name.equals(lv.getName())) {
                return Optional.of(lv);
            }
        }
        for (LocalVariable pv : function.getParameters()) {
            if (name.equals(pv.getName())) {
                return Optional.of(pv);
            }
        }
        for (LocalVariable rv : function.getReturns()) {
            if (name.equals(rv.getName())) {
                return Optional.of(rv);
            }
        }
        if (!function.isContainsAssembly()) {
            return Optional.empty();
        }
        for (Node node : function.getNodes()) {
            if (!node.isAssembly()) {
                continue;
            }
            for (String line : LINE_SPLITTER.split(node.getInlineAsm())) {
                AsmExpression sload;
                try {
                    sload = AsmParser.findAssignedCall(line, name, Constants.SLOAD).orElse(null);
                } catch (AsmParseException e) {
                    log.debug("アセンブリの解析失敗: {}", line, e);
                    continue;
                }
                if (sload == null || sload.getArguments().size() != 1) {
                    continue;
                }
                AsmExpression slot = sload.getArguments().get(0);
                Optional<? extends Variable> found;
                switch (slot.getKind()) {
                    case HEX:
                        found = SlotVariableFactory.create(slot.getText(), name);
                        break;
                    case NUMBER:
                        found = findVariableAtSlot(contract, new BigInteger(slot.getText()));
                        break;
                    case IDENTIFIER:
                        found = findDelegateFromName(contract, slot.getText(), function, visited);
                        break;
                    default:
                        found = Optional.empty();
                }
                if (found.isPresent()) {
                    return Optional.of(found.get());
                }
            }
        }
        return Optional.empty();
    }

    private Optional<StateVariable> findVariableAtSlot(Contract contract, BigInteger slot) {
        if (storageLayout == null) {
            log.warn("ストレージレイアウトがないためスロット{}を検索できない", slot);
            return Optional.empty();
        }
        for (StateVariable v : contract.getStateVariablesOrdered()) {
            Optional<SlotInfo> info = storageLayout.getStorageSlot(v, contract);
            if (info.isPresent() && slot.equals(info.get().getSlot())) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    private static String findLine(String asm, String keyword) {
        if (asm == null) {
            return null;
        }
        for (String line : LINE_SPLITTER.split(asm)) {
            if (line.contains(keyword)) {
                return line;
            }
        }
        return null;
    }

    static String stripSuffix(String name) {
        for (String suffix : Constants.ASM_NAME_SUFFIXES) {
            int index = name.indexOf(suffix);
            if (index > 0) {
                return name.substring(0, index);
            }
        }
        return name;
    }
}
