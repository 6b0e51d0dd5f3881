package net.katagaitai.sashikae.analysis;

import net.katagaitai.sashikae.model.Contract;
import net.katagaitai.sashikae.model.variable.StateVariable;

import java.util.Optional;

// 継承を含めたレイアウト計算は実装側で行う
public interface StorageLayout {
    Optional<SlotInfo> getStorageSlot(StateVariable variable, Contract contract);
}
