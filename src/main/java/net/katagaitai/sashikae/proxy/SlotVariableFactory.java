package net.katagaitai.sashikae.proxy;

import lombok.extern.slf4j.Slf4j;
import net.katagaitai.sashikae.model.expression.Literal;
import net.katagaitai.sashikae.model.type.ElementaryType;
import net.katagaitai.sashikae.model.variable.StateVariable;
import net.katagaitai.sashikae.util.Util;

import java.util.Optional;

// 作った変数はどのコントラクトにも登録しない
@Slf4j(topic = "sashikae")
public class SlotVariableFactory {

    public static Optional<StateVariable> create(String slot, String name) {
        if (!Util.isBytes32Hex(slot)) {
            // TODO: keccak256("eip1967.proxy.implementation") のようなハッシュ式のスロットも扱う
            log.debug("bytes32ではないスロット: {}", slot);
            return Optional.empty();
        }
        StateVariable variable = new StateVariable(
                name != null ? name : slot,
                ElementaryType.BYTES32,
                true,
                false,
                new Literal(slot, ElementaryType.BYTES32));
        return Optional.of(variable);
    }

    public static Optional<StateVariable> create(String slot) {
        return create(slot, null);
    }
}
