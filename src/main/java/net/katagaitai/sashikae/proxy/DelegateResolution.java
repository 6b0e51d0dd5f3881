package net.katagaitai.sashikae.proxy;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import net.katagaitai.sashikae.model.variable.Variable;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

@EqualsAndHashCode
@ToString
public class DelegateResolution {
    private static final DelegateResolution NOT_FOUND = new DelegateResolution(null);

    private final Variable variable;

    private DelegateResolution(Variable variable) {
        this.variable = variable;
    }

    public static DelegateResolution found(Variable variable) {
        return new DelegateResolution(checkNotNull(variable));
    }

    public static DelegateResolution notFound() {
        return NOT_FOUND;
    }

    public static DelegateResolution of(Optional<? extends Variable> variable) {
        return variable.isPresent() ? found(variable.get()) : NOT_FOUND;
    }

    public boolean isFound() {
        return variable != null;
    }

    public Variable getVariable() {
        checkState(isFound(), "not found");
        return variable;
    }

    public Optional<Variable> toOptional() {
        return Optional.ofNullable(variable);
    }
}
