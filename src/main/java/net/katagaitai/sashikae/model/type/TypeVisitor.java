package net.katagaitai.sashikae.model.type;

public interface TypeVisitor<R> {
    R visitElementary(ElementaryType type);

    R visitArray(ArrayType type);

    R visitMapping(MappingType type);

    R visitStructure(StructureType type);

    R visitEnum(EnumType type);

    R visitUserDefined(UserDefinedType type);

    R visitTuple(TupleType type);

    R visitOther(OtherType type);
}
