package org.jackc.compiler.backend.vm;

import org.jackc.compiler.frontend.semantics.SymbolKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link VmWriter} and the VM vocabulary enums.
 */
public class VmWriterTest {

    /**
     * Verifies the exact text of every instruction form.
     */
    @Test
    @Tag("unit")
    void testInstructionText() {
        // Arrange
        VmWriter writer = new VmWriter();

        // Act
        writer.writeFunction("Main.main", 2);
        writer.writePush(Segment.CONSTANT, 7);
        writer.writePop(Segment.THAT, 0);
        writer.writeArithmetic(ArithmeticCommand.NEG);
        writer.writeLabel("Main_0");
        writer.writeIf("Main_1");
        writer.writeGoto("Main_0");
        writer.writeCall("Math.multiply", 2);
        writer.writeReturn();

        // Assert
        assertThat(writer.lines()).containsExactly(
                "function Main.main 2",
                "push constant 7",
                "pop that 0",
                "neg",
                "label Main_0",
                "if-goto Main_1",
                "goto Main_0",
                "call Math.multiply 2",
                "return");
    }

    /**
     * Verifies the segment each variable kind lives in and the VM names of the enums.
     */
    @Test
    @Tag("unit")
    void testSegmentNames() {
        assertThat(Segment.of(SymbolKind.FIELD)).isEqualTo(Segment.THIS);
        assertThat(Segment.of(SymbolKind.VAR)).isEqualTo(Segment.LOCAL);
        assertThat(Segment.of(SymbolKind.ARGUMENT).vmName()).isEqualTo("argument");
        assertThat(Segment.of(SymbolKind.STATIC).vmName()).isEqualTo("static");
        assertThat(Segment.POINTER.vmName()).isEqualTo("pointer");
        assertThat(ArithmeticCommand.AND.vmName()).isEqualTo("and");
    }
}
