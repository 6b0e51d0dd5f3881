package net.katagaitai.sashikae.model.variable;

public interface VariableVisitor<R> {
    R visitStateVariable(StateVariable variable);

    R visitLocalVariable(LocalVariable variable);

    R visitLocalVariableInitFromTuple(LocalVariableInitFromTuple variable);

    R visitTemporaryVariable(TemporaryVariable variable);

    R visitReferenceVariable(ReferenceVariable variable);

    R visitConstant(Constant variable);

    R visitTupleVariable(TupleVariable variable);

    R visitSolidityVariable(SolidityVariable variable);

    R visitSolidityVariableComposed(SolidityVariableComposed variable);

    R visitUnsupported(UnsupportedVariable variable);
}
