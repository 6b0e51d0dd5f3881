package net.katagaitai.sashikae.model.ir;

public interface OperationVisitor<R> {
    R visitAssignment(Assignment op);

    R visitIndex(Index op);

    R visitMember(Member op);

    R visitLength(Length op);

    R visitBinary(Binary op);

    R visitUnary(Unary op);

    R visitCondition(Condition op);

    R visitNewStructure(NewStructure op);

    R visitNewContract(NewContract op);

    R visitNewArray(NewArray op);

    R visitNewElementaryType(NewElementaryType op);

    R visitDelete(Delete op);

    R visitSolidityCall(SolidityCall op);

    R visitInternalCall(InternalCall op);

    R visitEventCall(EventCall op);

    R visitLibraryCall(LibraryCall op);

    R visitInternalDynamicCall(InternalDynamicCall op);

    R visitHighLevelCall(HighLevelCall op);

    R visitLowLevelCall(LowLevelCall op);

    R visitTypeConversion(TypeConversion op);

    R visitReturn(Return op);

    R visitTransfer(Transfer op);

    R visitSend(Send op);

    R visitUnpack(Unpack op);

    R visitInitArray(InitArray op);

    R visitUnsupported(UnsupportedOperation op);
}
