package org.pycatalyst.compiler.backend.emit;

import org.pycatalyst.compiler.api.TranslatorOptions;
import org.pycatalyst.compiler.ir.IrFragment;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class CommentStitcherTest {

    private CommentStitcher stitcher;

    @BeforeEach
    void setUp() {
        stitcher = new CommentStitcher(TranslatorOptions.defaults());
    }

    @Test
    @Tag("unit")
    void testStandaloneCommentGoesToEntryFunction() {
        List<String> lines = List.of("# header", "x = 1");
        IrUnit unit = new IrUnit("t.py", lines.size());
        unit.entryFunction().addFragment(new IrFragment(2, 2, 5, "    int x = 1;"));

        stitcher.stitch(unit, lines);

        assertThat(unit.entryFunction().fragments()).extracting(IrFragment::text)
                .containsExactly("    // header", "    int x = 1;");
    }

    @Test
    @Tag("unit")
    void testCommentInsideFunctionKeepsSourceIndentation() {
        List<String> lines = List.of("def f():", "    # inside", "    return 1");
        IrUnit unit = new IrUnit("t.py", lines.size());
        IrFunction f = IrFunction.free("f", 1, 3);
        f.addFragment(new IrFragment(3, 3, 12, "    return 1;"));
        unit.registerFunction(f);

        stitcher.stitch(unit, lines);

        assertThat(f.fragments()).extracting(IrFragment::text).containsExactly("    // inside", "    return 1;");
        assertThat(unit.entryFunction().fragments()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testTrailingCommentIsAttached() {
        List<String> lines = List.of("x = 1  # one", "while x:  # loop", "    pass");
        IrUnit unit = new IrUnit("t.py", lines.size());
        IrFragment assign = new IrFragment(1, 1, 5, "    int x = 1;");
        IrFragment header = new IrFragment(2, 2, 7, "    while (x) {");
        unit.entryFunction().addFragment(assign);
        unit.entryFunction().addFragment(header);

        stitcher.stitch(unit, lines);

        assertThat(assign.comment()).isEqualTo("one");
        assertThat(header.comment()).isEqualTo("loop");
    }

    @Test
    @Tag("unit")
    void testPassThroughFragmentIsLeftAlone() {
        List<String> lines = List.of("import os  # needed");
        IrUnit unit = new IrUnit("t.py", lines.size());
        IrFragment refused = IrFragment.passThrough(1, 1,
                "    // Not translated: unsupported statement: Import\n    // import os  # needed", "unsupported statement: Import");
        unit.entryFunction().addFragment(refused);

        stitcher.stitch(unit, lines);

        assertThat(refused.comment()).isNull();
        assertThat(unit.entryFunction().fragments()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testCommentsCoveredByMultiLineFragmentAreNotDuplicated() {
        List<String> lines = List.of("if x:", "    # body", "    y = 1");
        IrUnit unit = new IrUnit("t.py", lines.size());
        unit.entryFunction().addFragment(IrFragment.passThrough(1, 3, "    // Not translated: r", "r"));

        stitcher.stitch(unit, lines);

        assertThat(unit.entryFunction().fragments()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testCodeAfterFragmentIsNotAComment() {
        List<String> lines = List.of("x = 1; y = 2");
        IrUnit unit = new IrUnit("t.py", lines.size());
        IrFragment first = new IrFragment(1, 1, 5, "    int x = 1;");
        unit.entryFunction().addFragment(first);

        stitcher.stitch(unit, lines);

        assertThat(first.comment()).isNull();
    }
}
