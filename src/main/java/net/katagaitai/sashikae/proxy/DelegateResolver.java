package net.katagaitai.sashikae.proxy;

import lombok.extern.slf4j.Slf4j;
import net.katagaitai.sashikae.analysis.DataDependency;
import net.katagaitai.sashikae.analysis.SlotInfo;
import net.katagaitai.sashikae.analysis.StorageLayout;
import net.katagaitai.sashikae.model.Contract;
import net.katagaitai.sashikae.model.Function;
import net.katagaitai.sashikae.model.cfg.Node;
import net.katagaitai.sashikae.model.cfg.NodeType;
import net.katagaitai.sashikae.model.expression.AssignmentOperation;
import net.katagaitai.sashikae.model.expression.CallExpression;
import net.katagaitai.sashikae.model.expression.Expression;
import net.katagaitai.sashikae.model.expression.Identifier;
import net.katagaitai.sashikae.model.expression.Literal;
import net.katagaitai.sashikae.model.ir.LowLevelCall;
import net.katagaitai.sashikae.model.ir.Operation;
import net.katagaitai.sashikae.model.variable.LocalVariable;
import net.katagaitai.sashikae.model.variable.StateVariable;
import net.katagaitai.sashikae.model.variable.Variable;
import net.katagaitai.sashikae.util.Constants;
import net.katagaitai.sashikae.util.Util;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

@Slf4j(topic = "sashikae")
public class DelegateResolver {
    private final DataDependency dataDependency;
    // nullならストレージレイアウトを使わない
    private final StorageLayout storageLayout;
    private final AssemblyMatcher assemblyMatcher;

    public DelegateResolver(DataDependency dataDependency) {
        this(dataDependency, null);
    }

    public DelegateResolver(DataDependency dataDependency, StorageLayout storageLayout) {
        this.dataDependency = checkNotNull(dataDependency);
        this.storageLayout = storageLayout;
        this.assemblyMatcher = new AssemblyMatcher(storageLayout);
    }

    // ローカル変数ならデータ依存で最初に現れる状態変数に置き換える。なければローカル変数のまま
    public DelegateResolution resolve(Contract proxy) {
        checkNotNull(proxy);
        if (!proxy.isUpgradeableProxy() || proxy.getFallbackFunction() == null) {
            return DelegateResolution.notFound();
        }
        DelegateResolution delegate = findDelegateInFallback(proxy);
        if (delegate.isFound() && delegate.getVariable() instanceof LocalVariable) {
            List<Variable> dependencies = dataDependency.getDependencies(delegate.getVariable(), proxy);
            Optional<Variable> stateVariable = dependencies.stream()
                    .filter(v -> v instanceof StateVariable)
                    .findFirst();
            if (stateVariable.isPresent()) {
                delegate = DelegateResolution.found(stateVariable.get());
            } else {
                log.debug("依存する状態変数なし: {}", delegate.getVariable());
            }
        }
        log.info("{}: delegate={}", proxy, delegate.toOptional().map(Variable::getName).orElse(null));
        return delegate;
    }

    // IRのdelegatecallを最優先し、なければノード順にアセンブリか式から探す
    public DelegateResolution findDelegateInFallback(Contract proxy) {
        Function fallback = proxy.getFallbackFunction();
        for (Node node : fallback.getNodes()) {
            for (Operation ir : node.getIrs()) {
                if (ir instanceof LowLevelCall
                        && Constants.DELEGATECALL.equals(((LowLevelCall) ir).getFunctionName())) {
                    Variable destination = ((LowLevelCall) ir).getDestination();
                    if (destination == null) {
                        log.debug("呼び出し先のないdelegatecall: {}", ir);
                        continue;
                    }
                    log.debug("IRのdelegatecall: {}", ir);
                    return DelegateResolution.found(destination);
                }
            }
        }
        for (Node node : fallback.getNodes()) {
            DelegateResolution delegate = DelegateResolution.notFound();
            if (node.isAssembly() && node.getInlineAsm().contains(Constants.DELEGATECALL)) {
                delegate = assemblyMatcher.extractDelegate(proxy, node);
            } else if (node.getType() == NodeType.EXPRESSION) {
                delegate = extractDelegateFromExpression(node.getExpression());
            }
            if (delegate.isFound()) {
                return delegate;
            }
        }
        return DelegateResolution.notFound();
    }

    private DelegateResolution extractDelegateFromExpression(Expression expression) {
        if (expression instanceof AssignmentOperation) {
            expression = ((AssignmentOperation) expression).getExpressionRight();
        }
        if (!(expression instanceof CallExpression)) {
            return DelegateResolution.notFound();
        }
        CallExpression call = (CallExpression) expression;
        if (!call.getCalled().toString().contains(Constants.DELEGATECALL) || call.getArguments().size() <= 1) {
            return DelegateResolution.notFound();
        }
        Expression dest = call.getArguments().get(1);
        if (dest instanceof CallExpression && ((CallExpression) dest).getCalled().toString().contains(Constants.SLOAD)
                && !((CallExpression) dest).getArguments().isEmpty()) {
            dest = ((CallExpression) dest).getArguments().get(0);
        }
        if (dest instanceof Identifier && ((Identifier) dest).getValue() != null) {
            return DelegateResolution.found(((Identifier) dest).getValue());
        }
        if (dest instanceof Literal) {
            // スロットが定数として宣言されずにハードコードされている
            return DelegateResolution.of(SlotVariableFactory.create(((Literal) dest).getValue()));
        }
        return DelegateResolution.notFound();
    }

    // 可変の状態変数ならストレージレイアウト、bytes32の定数ならその値がスロット
    public Optional<SlotInfo> resolveImplementationSlot(Contract proxy) {
        DelegateResolution delegate = resolve(proxy);
        if (!delegate.isFound() || !(delegate.getVariable() instanceof StateVariable)) {
            return Optional.empty();
        }
        StateVariable variable = (StateVariable) delegate.getVariable();
        if (variable.isMutable()) {
            if (storageLayout == null) {
                log.warn("ストレージレイアウトがないため{}のスロットを求められない", variable);
                return Optional.empty();
            }
            return storageLayout.getStorageSlot(variable, proxy);
        }
        if (variable.isConstant()
                && variable.getType() != null
                && Constants.BYTES32_TYPE.equals(variable.getType().toString())
                && variable.getExpression() instanceof Literal) {
            String value = ((Literal) variable.getExpression()).getValue();
            if (!Util.isHex(value)) {
                log.debug("16進数ではないスロット: {}", value);
                return Optional.empty();
            }
            return Optional.of(new SlotInfo(
                    variable.getName(),
                    Constants.ADDRESS_TYPE,
                    Util.hexToBigInteger(value),
                    Constants.ADDRESS_BIT_SIZE,
                    0));
        }
        return Optional.empty();
    }
}
