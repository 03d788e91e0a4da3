package mutant.analysis;

import java.io.PrintStream;
import java.util.List;

import mutant.ast.Node;
import mutant.ast.Slot;

/*
 * Indented node tree printer. Helpful to see what the reader produced before
 * looking at the mutants of a method.
 */
public class AstTreePrinter {
    private final PrintStream out;
    private int indent = 0;

    public AstTreePrinter(PrintStream out) {
        this.out = out;
    }

    private void printIndent(String text) {
        for (int i = 0; i < indent; i++) {
            out.print("--");
        }
        out.println(text);
    }

    public void print(Node node) {
        if (node == null) {
            return;
        }
        StringBuilder details = new StringBuilder(node.type().name());
        details.append(" @ ").append(node.position());

        List<Slot> slots = node.type().slots();
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).kind() == Slot.Kind.SCALAR) {
                details.append(" : ").append(slots.get(i).name()).append('=').append(node.child(i));
            }
        }
        printIndent(details.toString());

        indent++;
        for (int i = 0; i < slots.size(); i++) {
            Slot slot = slots.get(i);
            switch (slot.kind()) {
                case NODE:
                case OPTIONAL_NODE:
                    print((Node) node.child(i));
                    break;
                case NODE_LIST:
                    for (Node element : node.elements()) {
                        print(element);
                    }
                    break;
                default:
                    break;
            }
        }
        indent--;
    }
}
