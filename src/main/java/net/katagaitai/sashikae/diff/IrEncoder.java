package net.katagaitai.sashikae.diff;

import net.katagaitai.sashikae.model.ir.*;
import net.katagaitai.sashikae.model.variable.*;

// 同じ構造の命令は変数名によらず同じ文字列になる
public class IrEncoder {
    private static final OperationVisitor<String> OPERATION_ENCODER = new OperationEncoder();
    private static final VariableVisitor<String> VARIABLE_ENCODER = new VariableEncoder();

    public static String encodeOperation(Operation ir) {
        return ir.accept(OPERATION_ENCODER);
    }

    public static String encodeVariable(Variable var) {
        if (var == null) {
            return "none";
        }
        return var.accept(VARIABLE_ENCODER);
    }

    private static class OperationEncoder implements OperationVisitor<String> {
        @Override
        public String visitAssignment(Assignment op) {
            return "(" + encodeVariable(op.getLvalue()) + "):=(" + encodeVariable(op.getRvalue()) + ")";
        }

        @Override
        public String visitIndex(Index op) {
            return "index(" + TypeCategorizer.categorize(op.getIndexType()) + ")";
        }

        @Override
        public String visitMember(Member op) {
            return "member";
        }

        @Override
        public String visitLength(Length op) {
            return "length";
        }

        @Override
        public String visitBinary(Binary op) {
            return "binary(" + op.getVariableLeft() + op.getType() + op.getVariableRight() + ")";
        }

        @Override
        public String visitUnary(Unary op) {
            return "unary(" + op.getType() + ")";
        }

        @Override
        public String visitCondition(Condition op) {
            return "condition(" + encodeVariable(op.getValue()) + ")";
        }

        @Override
        public String visitNewStructure(NewStructure op) {
            return "new_structure";
        }

        @Override
        public String visitNewContract(NewContract op) {
            return "new_contract";
        }

        @Override
        public String visitNewArray(NewArray op) {
            return "new_array(" + TypeCategorizer.categorize(op.getArrayType()) + ")";
        }

        @Override
        public String visitNewElementaryType(NewElementaryType op) {
            return "new_elementary(" + TypeCategorizer.categorize(op.getType()) + ")";
        }

        @Override
        public String visitDelete(Delete op) {
            return "delete(" + encodeVariable(op.getLvalue()) + "," + encodeVariable(op.getVariable()) + ")";
        }

        @Override
        public String visitSolidityCall(SolidityCall op) {
            return "solidity_call(" + op.getFunctionFullName() + ")";
        }

        @Override
        public String visitInternalCall(InternalCall op) {
            return "internal_call(" + TypeCategorizer.categorize(op.getTypeCall()) + ")";
        }

        @Override
        public String visitEventCall(EventCall op) {
            return "event";
        }

        @Override
        public String visitLibraryCall(LibraryCall op) {
            return "library_call";
        }

        @Override
        public String visitInternalDynamicCall(InternalDynamicCall op) {
            return "internal_dynamic_call";
        }

        @Override
        public String visitHighLevelCall(HighLevelCall op) {
            // TODO: 呼び出し先の関数名も含める
            return "high_level_call";
        }

        @Override
        public String visitLowLevelCall(LowLevelCall op) {
            return "low_level_call";
        }

        @Override
        public String visitTypeConversion(TypeConversion op) {
            return "type_conversion(" + TypeCategorizer.categorize(op.getType()) + ")";
        }

        @Override
        public String visitReturn(Return op) {
            return "return";
        }

        @Override
        public String visitTransfer(Transfer op) {
            return "transfer(" + encodeVariable(op.getCallValue()) + ")";
        }

        @Override
        public String visitSend(Send op) {
            return "send(" + encodeVariable(op.getCallValue()) + ")";
        }

        @Override
        public String visitUnpack(Unpack op) {
            return "unpack";
        }

        @Override
        public String visitInitArray(InitArray op) {
            return "init_array";
        }

        @Override
        public String visitUnsupported(UnsupportedOperation op) {
            // 種類ごとに別の文字列にして、未対応の命令同士が一致しないようにする
            return "unsupported(" + op.getKind() + ")";
        }
    }

    private static class VariableEncoder implements VariableVisitor<String> {
        @Override
        public String visitStateVariable(StateVariable variable) {
            return "state_solc_variable(" + TypeCategorizer.categorize(variable.getType()) + ")";
        }

        @Override
        public String visitLocalVariable(LocalVariable variable) {
            return "local_solc_variable(" + variable.getLocation() + ")";
        }

        @Override
        public String visitLocalVariableInitFromTuple(LocalVariableInitFromTuple variable) {
            return "local_variable_init_tuple";
        }

        @Override
        public String visitTemporaryVariable(TemporaryVariable variable) {
            return "temporary_variable";
        }

        @Override
        public String visitReferenceVariable(ReferenceVariable variable) {
            return "reference";
        }

        @Override
        public String visitConstant(Constant variable) {
            return "constant(" + TypeCategorizer.categorize(variable.getType()) + ")";
        }

        @Override
        public String visitTupleVariable(TupleVariable variable) {
            return "tuple_variable";
        }

        @Override
        public String visitSolidityVariable(SolidityVariable variable) {
            return "solidity_variable(" + variable.getName() + ")";
        }

        @Override
        public String visitSolidityVariableComposed(SolidityVariableComposed variable) {
            return "solidity_variable_composed(" + variable.getName() + ")";
        }

        @Override
        public String visitUnsupported(UnsupportedVariable variable) {
            return "unsupported(" + variable.getKind() + ")";
        }
    }
}
