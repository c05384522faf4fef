package org.jackc.compiler.backend.vm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates VM instruction lines in emission order.
 * Every method appends exactly one line using the textual vocabulary the VM translator reads.
 */
public class VmWriter {

    private final List<String> lines = new ArrayList<>();

    public void writePush(Segment segment, int index) {
        lines.add("push " + segment.vmName() + " " + index);
    }

    public void writePop(Segment segment, int index) {
        lines.add("pop " + segment.vmName() + " " + index);
    }

    public void writeArithmetic(ArithmeticCommand command) {
        lines.add(command.vmName());
    }

    public void writeLabel(String label) {
        lines.add("label " + label);
    }

    public void writeGoto(String label) {
        lines.add("goto " + label);
    }

    public void writeIf(String label) {
        lines.add("if-goto " + label);
    }

    /**
     * @param name The qualified name, {@code Class.subroutine}.
     * @param argumentCount The number of arguments on the stack, receiver included.
     */
    public void writeCall(String name, int argumentCount) {
        lines.add("call " + name + " " + argumentCount);
    }

    /**
     * @param name The qualified name, {@code Class.subroutine}.
     * @param localCount The number of local variables.
     */
    public void writeFunction(String name, int localCount) {
        lines.add("function " + name + " " + localCount);
    }

    public void writeReturn() {
        lines.add("return");
    }

    /**
     * @return The lines written so far, as an unmodifiable view.
     */
    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }
}
