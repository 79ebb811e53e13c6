package io.streamshub.tilde.value;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PrettyPrinterTest {

    private static Symbol sym(String name) {
        return Symbol.of(name);
    }

    @Test
    void testFittingListStaysOnOneLine() {
        assertEquals("(1 2 3)\n", new PrettyPrinter().print(Values.list(1, 2, 3)));
        assertEquals("()\n", new PrettyPrinter().print(EmptyList.INSTANCE));
    }

    @Test
    void testLongListBreaksOnePerLine() {
        PrettyPrinter printer = new PrettyPrinter(SchemeRenderer.MACHINE, 10);

        assertEquals("(alpha\n beta\n gamma)\n",
                printer.print(Values.list(sym("alpha"), sym("beta"), sym("gamma"))));
    }

    @Test
    void testNestedListsFitAfterBreaking() {
        PrettyPrinter printer = new PrettyPrinter(SchemeRenderer.MACHINE, 12);
        Object value = Values.list(sym("define"), Values.list(sym("f"), sym("x")), Values.list(sym("+"), sym("x"), 1));

        assertEquals("(define\n (f x)\n (+ x 1))\n", printer.print(value));
    }

    @Test
    void testNestedListsBreakRecursively() {
        PrettyPrinter printer = new PrettyPrinter(SchemeRenderer.MACHINE, 8);
        Object value = Values.list(1, Values.list(sym("aaaa"), sym("bbbb")));

        assertEquals("(1\n (aaaa\n  bbbb))\n", printer.print(value));
    }

    @Test
    void testVectorIndent() {
        PrettyPrinter printer = new PrettyPrinter(SchemeRenderer.MACHINE, 6);

        assertEquals("#(\"aaa\"\n  \"bbb\")\n", printer.print(new Object[] { "aaa", "bbb" }));
    }

    @Test
    void testLongAtomsAndImproperListsStayFlat() {
        PrettyPrinter printer = new PrettyPrinter(SchemeRenderer.MACHINE, 4);

        assertEquals("\"a long string\"\n", printer.print("a long string"));
        assertEquals("(1 . 2)\n", printer.print(Values.dotted(2, 1)));
    }

    @Test
    void testDefaultLineWidth() {
        assertEquals(PrettyPrinter.DEFAULT_LINE_WIDTH, new PrettyPrinter().lineWidth());
        assertThrows(IllegalArgumentException.class, () -> new PrettyPrinter(SchemeRenderer.MACHINE, 0));
    }
}
