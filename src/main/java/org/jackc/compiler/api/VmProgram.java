package org.jackc.compiler.api;

import java.util.List;

/**
 * The output of compiling one class: its VM instruction lines in emission order.
 *
 * @param className The name of the compiled class.
 * @param sourceName The logical name of the source the class came from.
 * @param instructions The stack-machine instructions, one per line, without indentation.
 */
public record VmProgram(String className, String sourceName, List<String> instructions) {

    public VmProgram {
        instructions = List.copyOf(instructions);
    }

    /**
     * Renders the program as VM file text: lines joined by {@code \n}, no trailing newline.
     * @param indent Whether to indent all lines except {@code function} and {@code label} lines.
     * @return The rendered text.
     */
    public String render(boolean indent) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < instructions.size(); i++) {
            String line = instructions.get(i);
            if (indent && !line.startsWith("function ") && !line.startsWith("label ")) {
                sb.append("    ");
            }
            sb.append(line);
            if (i + 1 < instructions.size()) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }
}
