package net.katagaitai.sashikae.diff;

import net.katagaitai.sashikae.model.type.*;

public class TypeCategorizer {
    private static final String[] COLLAPSED_CATEGORIES = {"struct", "enum", "tuple", "contract", "mapping"};
    private static final TypeVisitor<String> DESCRIBER = new Describer();

    public static String categorize(Type type) {
        if (type == null) {
            return "void";
        }
        String s = type.accept(DESCRIBER);
        s = s.replace(" memory", "");
        s = s.replace(" storage ref", "");
        for (String category : COLLAPSED_CATEGORIES) {
            if (s.contains(category)) {
                return category;
            }
        }
        return s.replace(" ", "_");
    }

    private static class Describer implements TypeVisitor<String> {
        @Override
        public String visitElementary(ElementaryType type) {
            return type.toString();
        }

        @Override
        public String visitArray(ArrayType type) {
            if (type.getType() instanceof ElementaryType) {
                return type.toString();
            }
            return "user_defined_array";
        }

        @Override
        public String visitMapping(MappingType type) {
            return type.toString();
        }

        @Override
        public String visitStructure(StructureType type) {
            return type.toString();
        }

        @Override
        public String visitEnum(EnumType type) {
            return type.toString();
        }

        @Override
        public String visitUserDefined(UserDefinedType type) {
            switch (type.getKind()) {
                case CONTRACT:
                    return "contract(" + type.getName() + ")";
                case STRUCTURE:
                    return "struct(" + type.getName() + ")";
                case ENUM:
                    return "enum(" + type.getName() + ")";
                default:
                    return type.toString();
            }
        }

        @Override
        public String visitTuple(TupleType type) {
            return type.toString();
        }

        @Override
        public String visitOther(OtherType type) {
            return type.toString();
        }
    }
}
