package com.pystructure.core.analyzer;

import com.pystructure.core.ast.PythonTree.BinOp;
import com.pystructure.core.ast.PythonTree.Call;
import com.pystructure.core.ast.PythonTree.Constant;
import com.pystructure.core.ast.PythonTree.DictExpr;
import com.pystructure.core.ast.PythonTree.Expr;
import com.pystructure.core.ast.PythonTree.Index;
import com.pystructure.core.ast.PythonTree.Keyword;
import com.pystructure.core.ast.PythonTree.ListExpr;
import com.pystructure.core.ast.PythonTree.Opaque;
import com.pystructure.core.ast.PythonTree.SetExpr;
import com.pystructure.core.ast.PythonTree.Slice;
import com.pystructure.core.ast.PythonTree.TupleExpr;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.pystructure.core.ast.TreeBuilder.attr;
import static com.pystructure.core.ast.TreeBuilder.call;
import static com.pystructure.core.ast.TreeBuilder.name;
import static com.pystructure.core.ast.TreeBuilder.none;
import static com.pystructure.core.ast.TreeBuilder.num;
import static com.pystructure.core.ast.TreeBuilder.str;
import static com.pystructure.core.ast.TreeBuilder.subscript;
import static com.pystructure.core.ast.TreeBuilder.union;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NodeRenderer}.
 */
class NodeRendererTest {

    @Test
    void render_null_returnsNull() {
        assertThat(NodeRenderer.render(null)).isNull();
    }

    @Test
    void render_exhaustedDepth_returnsEllipsis() {
        assertThat(NodeRenderer.render(name("x"), 0)).isEqualTo("...");
    }

    @Test
    void render_unmodeledNode_returnsKindName() {
        assertThat(NodeRenderer.render(new Opaque("Lambda", 3, List.of()))).isEqualTo("Lambda");
    }

    @Test
    void render_shortString_isQuoted() {
        assertThat(NodeRenderer.render(str("hello"))).isEqualTo("'hello'");
    }

    @Test
    void render_longString_isTruncatedToThirtyCharacters() {
        String rendered = NodeRenderer.render(str("a".repeat(40)));

        assertThat(rendered)
            .hasSize(30)
            .isEqualTo("'" + "a".repeat(26) + "...");
    }

    @Test
    void render_stringOfThirtyCharacters_isKept() {
        String rendered = NodeRenderer.render(str("a".repeat(28)));

        assertThat(rendered).isEqualTo("'" + "a".repeat(28) + "'");
    }

    @Test
    void render_longNonStringLiteral_isNotTruncated() {
        String digits = "1".repeat(40);
        Constant big = new Constant(null, digits);

        assertThat(NodeRenderer.render(big)).isEqualTo(digits);
    }

    @Test
    void render_noneAndBooleans_usePythonSpelling() {
        assertThat(NodeRenderer.render(none())).isEqualTo("None");
        assertThat(NodeRenderer.render(Constant.of(true))).isEqualTo("True");
        assertThat(NodeRenderer.render(num(42))).isEqualTo("42");
    }

    @Test
    void render_dottedAttribute_returnsFullPath() {
        assertThat(NodeRenderer.render(attr("typing", "List"))).isEqualTo("typing.List");
    }

    @Test
    void render_genericType_returnsSubscript() {
        assertThat(NodeRenderer.render(subscript(name("List"), name("int")))).isEqualTo("List[int]");
    }

    @Test
    void render_tupleSlice_returnsParenthesized() {
        Expr dict = subscript(name("Dict"), new TupleExpr(List.of(name("str"), name("int"))));

        assertThat(NodeRenderer.render(dict)).isEqualTo("Dict[(str, int)]");
    }

    @Test
    void render_deepNesting_isCutAtDefaultDepth() {
        Expr optionalDict = subscript(name("Optional"),
            subscript(name("Dict"), new TupleExpr(List.of(name("str"), name("int")))));

        assertThat(NodeRenderer.render(optionalDict)).isEqualTo("Optional[Dict[(..., ...)]]");
    }

    @Test
    void render_legacyIndex_returnsInnerValue() {
        Expr legacy = subscript(name("List"), new Index(name("str")));

        assertThat(NodeRenderer.render(legacy)).isEqualTo("List[str]");
    }

    @Test
    void render_slice_omitsMissingParts() {
        assertThat(NodeRenderer.render(new Slice(num(1), null, null))).isEqualTo("1:");
        assertThat(NodeRenderer.render(new Slice(null, null, num(2)))).isEqualTo("::2");
        assertThat(NodeRenderer.render(new Slice(num(1), num(5), null))).isEqualTo("1:5");
    }

    @Test
    void render_shortList_returnsAllElements() {
        Expr list = new ListExpr(List.of(num(1), num(2), num(3)));

        assertThat(NodeRenderer.render(list)).isEqualTo("[1, 2, 3]");
    }

    @Test
    void render_longList_isTruncated() {
        List<Expr> letters = new ArrayList<>();
        for (char c = 'a'; c <= 'z'; c++) {
            letters.add(name(String.valueOf(c)));
        }

        assertThat(NodeRenderer.render(new ListExpr(letters)))
            .isEqualTo("[a, b, c, d, e, f, g, h, i, ...]");
    }

    @Test
    void render_tupleAndSet_useTheirBrackets() {
        assertThat(NodeRenderer.render(new TupleExpr(List.of(num(1), num(2))))).isEqualTo("(1, 2)");
        assertThat(NodeRenderer.render(new SetExpr(List.of(str("x"))))).isEqualTo("{'x'}");
    }

    @Test
    void render_dictWithThreeEntries_returnsAll() {
        Expr dict = new DictExpr(List.of(str("a"), str("b"), str("c")), List.of(num(1), num(2), num(3)));

        assertThat(NodeRenderer.render(dict)).isEqualTo("{'a': 1, 'b': 2, 'c': 3}");
    }

    @Test
    void render_dictWithMoreEntries_showsEllipsisAfterThird() {
        Expr dict = new DictExpr(
            List.of(str("a"), str("b"), str("c"), str("d"), str("e")),
            List.of(num(1), num(2), num(3), num(4), num(5)));

        assertThat(NodeRenderer.render(dict)).isEqualTo("{'a': 1, 'b': 2, 'c': 3, ...}");
    }

    @Test
    void render_dictUnpacking_returnsQuestionMarkKey() {
        Expr dict = new DictExpr(Arrays.asList((Expr) null), List.of(name("defaults")));

        assertThat(NodeRenderer.render(dict)).isEqualTo("{?: defaults}");
    }

    @Test
    void render_call_returnsPositionalArguments() {
        assertThat(NodeRenderer.render(call(name("Field"), num(0)))).isEqualTo("Field(0)");
    }

    @Test
    void render_callWithKeywords_endsWithEllipsis() {
        Expr field = new Call(name("field"), List.of(), List.of(new Keyword("default_factory", name("list"))));

        assertThat(NodeRenderer.render(field)).isEqualTo("field(, ...)");
    }

    @Test
    void render_callWithLongArguments_isTruncated() {
        Expr longCall = call(name("f"), str("abcdefghijklmnopqrstuvwxyz"));

        assertThat(NodeRenderer.render(longCall)).isEqualTo("f('abcdefghijklmnop...)");
    }

    @Test
    void render_unionWithNone_returnsOptional() {
        assertThat(NodeRenderer.render(union(name("str"), none()))).isEqualTo("Optional[str]");
        assertThat(NodeRenderer.render(union(none(), name("int")))).isEqualTo("Optional[int]");
    }

    @Test
    void render_unionOfTypes_returnsUnion() {
        assertThat(NodeRenderer.render(union(name("int"), name("str")))).isEqualTo("Union[int, str]");
    }

    @Test
    void render_otherBinaryOperator_returnsKindName() {
        assertThat(NodeRenderer.render(new BinOp(num(1), "Add", num(2)))).isEqualTo("BinOp");
    }
}
