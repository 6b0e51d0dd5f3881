package net.katagaitai.sashikae.diff;

import com.google.common.collect.Lists;
import net.katagaitai.sashikae.model.type.*;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class TypeCategorizerTest {

    @Test
    public void test_基本型はそのまま() throws Exception {
        assertEquals("uint256", TypeCategorizer.categorize(ElementaryType.UINT256));
        assertEquals("address", TypeCategorizer.categorize(ElementaryType.ADDRESS));
        assertEquals("bytes32", TypeCategorizer.categorize(ElementaryType.BYTES32));
    }

    @Test
    public void test_nullはvoid() throws Exception {
        assertEquals("void", TypeCategorizer.categorize(null));
    }

    @Test
    public void test_基本型の配列() throws Exception {
        assertEquals("uint256[]", TypeCategorizer.categorize(new ArrayType(ElementaryType.UINT256)));
        assertEquals("address[3]", TypeCategorizer.categorize(new ArrayType(ElementaryType.ADDRESS, 3)));
    }

    @Test
    public void test_ユーザー定義型の配列() throws Exception {
        Type type = new ArrayType(new UserDefinedType(UserDefinedType.Kind.STRUCTURE, "Deposit"));
        assertEquals("user_defined_array", TypeCategorizer.categorize(type));
    }

    @Test
    public void test_キーワードを含む型はまとめる() throws Exception {
        assertEquals("mapping", TypeCategorizer.categorize(
                new MappingType(ElementaryType.ADDRESS, ElementaryType.UINT256)));
        assertEquals("contract", TypeCategorizer.categorize(
                new UserDefinedType(UserDefinedType.Kind.CONTRACT, "Token")));
        assertEquals("struct", TypeCategorizer.categorize(
                new UserDefinedType(UserDefinedType.Kind.STRUCTURE, "Deposit")));
        assertEquals("enum", TypeCategorizer.categorize(
                new UserDefinedType(UserDefinedType.Kind.ENUM, "State")));
        assertEquals("tuple", TypeCategorizer.categorize(
                new TupleType(Lists.newArrayList(ElementaryType.UINT256, ElementaryType.BOOL))));
    }

    @Test
    public void test_マッピングの値が構造体でもmapping() throws Exception {
        Type type = new MappingType(ElementaryType.ADDRESS,
                new UserDefinedType(UserDefinedType.Kind.STRUCTURE, "Deposit"));
        assertEquals("mapping", TypeCategorizer.categorize(type));
    }

    @Test
    public void test_データロケーションは無視する() throws Exception {
        assertEquals("string", TypeCategorizer.categorize(new OtherType("string memory")));
        assertEquals("bytes", TypeCategorizer.categorize(new OtherType("bytes storage ref")));
        assertEquals(
                TypeCategorizer.categorize(new OtherType("string")),
                TypeCategorizer.categorize(new OtherType("string memory")));
    }

    @Test
    public void test_空白はアンダースコアにする() throws Exception {
        assertEquals("function_(uint256)_external",
                TypeCategorizer.categorize(new OtherType("function (uint256) external")));
    }

    @Test
    public void test_宣言そのものの型は名前() throws Exception {
        assertEquals("Deposit", TypeCategorizer.categorize(new StructureType("Deposit")));
        assertEquals("State", TypeCategorizer.categorize(new EnumType("State")));
    }
}
